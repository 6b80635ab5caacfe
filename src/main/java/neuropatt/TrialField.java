package neuropatt;

import java.util.BitSet;

/**
 * Inputs of pattern detection for one trial. {@code vx} and {@code vy} hold
 * {@code timesteps} snapshots, {@code phase} holds the transform phase with
 * one snapshot more. Bad channels are indexed {@code row * cols + col}.
 */
public final class TrialField {

	private final int rows;
	private final int cols;
	private final int timesteps;
	private final double samplingRate;
	private final double[] vx;
	private final double[] vy;
	private final double[] phase;
	private final BitSet badChannels;
	private final boolean allBad;

	public TrialField(int rows, int cols, int timesteps, double samplingRate, double[] vx, double[] vy,
			double[] phase) {
		this(rows, cols, timesteps, samplingRate, vx, vy, phase, new BitSet());
	}

	public TrialField(int rows, int cols, int timesteps, double samplingRate, double[] vx, double[] vy,
			double[] phase, BitSet badChannels) {
		this.rows = rows;
		this.cols = cols;
		this.timesteps = timesteps;
		this.samplingRate = samplingRate;
		this.vx = vx;
		this.vy = vy;
		this.phase = phase;
		this.badChannels = (BitSet) badChannels.clone();
		this.allBad = badChannels.cardinality() >= rows * cols;
	}

	public int getRows() {
		return this.rows;
	}

	public int getCols() {
		return this.cols;
	}

	public int getTimesteps() {
		return this.timesteps;
	}

	public double getSamplingRate() {
		return this.samplingRate;
	}

	public boolean isBad(int row, int col) {
		return badChannels.get(row * cols + col);
	}

	/**
	 * Whether a location takes part in summaries over the whole array. If
	 * every channel is bad, all of them do.
	 */
	public boolean isUsable(int row, int col) {
		return allBad || !isBad(row, col);
	}

	public int index(int row, int col, int time) {
		return (time * rows + row) * cols + col;
	}

	public double vx(int row, int col, int time) {
		return vx[index(row, col, time)];
	}

	public double vy(int row, int col, int time) {
		return vy[index(row, col, time)];
	}

	public Velocity velocity(int row, int col, int time) {
		int pos = index(row, col, time);
		return new Velocity(vx[pos], vy[pos]);
	}

	public double phase(int row, int col, int time) {
		return phase[index(row, col, time)];
	}
}
