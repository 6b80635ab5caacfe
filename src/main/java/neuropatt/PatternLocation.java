package neuropatt;

import java.io.Serializable;

/**
 * Position of a pattern at each step it was present. Patterns without a
 * point location (plane waves, synchrony) carry NaN coordinates.
 */
public final class PatternLocation implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int[] times;
	private final double[] rows;
	private final double[] cols;

	public PatternLocation(int[] times, double[] rows, double[] cols) {
		if (times.length != rows.length || times.length != cols.length) {
			throw new IllegalArgumentException("Location arrays differ in length");
		}
		this.times = times;
		this.rows = rows;
		this.cols = cols;
	}

	public int size() {
		return this.times.length;
	}

	public int getTime(int i) {
		return this.times[i];
	}

	public double getRow(int i) {
		return this.rows[i];
	}

	public double getCol(int i) {
		return this.cols[i];
	}
}
