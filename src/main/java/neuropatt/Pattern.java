package neuropatt;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One detected pattern instance. The analysis only relies on the type and on
 * the time span; {@link #getValues()} holds the full result row in the order
 * of {@link PatternVocabulary#getColumnNames()}.
 */
public final class Pattern implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int type;
	private final int start;
	private final int end;
	private final double[] values;

	/**
	 * @param type  zero based index into the vocabulary
	 * @param start first velocity snapshot of the pattern
	 * @param end   last velocity snapshot of the pattern, inclusive
	 */
	public Pattern(int type, int start, int end, double[] values) {
		if (end < start) {
			throw new IllegalArgumentException("Pattern ends before it starts: " + start + " > " + end);
		}
		this.type = type;
		this.start = start;
		this.end = end;
		this.values = values;
	}

	public Pattern(int type, int start, int end) {
		this(type, start, end, new double[] { type, start, end, end - start + 1 });
	}

	public int getType() {
		return this.type;
	}

	public int getStart() {
		return this.start;
	}

	public int getEnd() {
		return this.end;
	}

	public int getDuration() {
		return this.end - this.start + 1;
	}

	public double[] getValues() {
		return Arrays.copyOf(values, values.length);
	}

	@Override
	public String toString() {
		return "Pattern [type=" + type + ", " + start + ".." + end + "]";
	}
}
