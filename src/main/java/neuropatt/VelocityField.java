package neuropatt;

import java.io.Serializable;
import java.util.List;

/**
 * Velocity vectors at every (row, column, time, trial) cell. Has one time
 * sample fewer than the coefficients it was estimated from. Never modified
 * once assembled.
 *
 * @author Ben
 *
 */
public class VelocityField implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int rows;
	private final int cols;
	private final int timesteps;
	private final int trials;
	private final double[] vx;
	private final double[] vy;

	private VelocityField(int rows, int cols, int timesteps, int trials, double[] vx, double[] vy) {
		this.rows = rows;
		this.cols = cols;
		this.timesteps = timesteps;
		this.trials = trials;
		this.vx = vx;
		this.vy = vy;
	}

	/**
	 * Merges independently computed trial slices into one field. Slice
	 * {@code i} becomes trial {@code i}.
	 */
	public static VelocityField assemble(int rows, int cols, int timesteps, List<FlowResult> slices) {
		int size = rows * cols * timesteps;
		double[] vx = new double[size * slices.size()];
		double[] vy = new double[size * slices.size()];
		for (int trial = 0; trial < slices.size(); trial++) {
			FlowResult slice = slices.get(trial);
			System.arraycopy(slice.getVx(), 0, vx, trial * size, size);
			System.arraycopy(slice.getVy(), 0, vy, trial * size, size);
		}
		return new VelocityField(rows, cols, timesteps, slices.size(), vx, vy);
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

	public int getTrials() {
		return this.trials;
	}

	public int getLocation(int row, int col, int time, int trial) {
		return ((trial * timesteps + time) * rows + row) * cols + col;
	}

	public Velocity get(int row, int col, int time, int trial) {
		int pos = getLocation(row, col, time, trial);
		return new Velocity(vx[pos], vy[pos]);
	}

	/**
	 * x components of one trial, snapshot by snapshot, as a copy.
	 */
	public double[] real(int trial) {
		return slice(vx, trial);
	}

	/**
	 * y components of one trial, snapshot by snapshot, as a copy.
	 */
	public double[] imag(int trial) {
		return slice(vy, trial);
	}

	private double[] slice(double[] component, int trial) {
		int size = rows * cols * timesteps;
		double[] ret = new double[size];
		System.arraycopy(component, trial * size, ret, 0, size);
		return ret;
	}
}
