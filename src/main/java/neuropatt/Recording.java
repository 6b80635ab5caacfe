package neuropatt;

import java.io.Serializable;
import java.util.Arrays;

import neuropatt.exception.InvalidShapeException;

/**
 * Real valued (row, column, time, trial) tensor of a multichannel recording.
 * Time is always the third axis. Samples are stored snapshot by snapshot, so
 * one trial occupies a contiguous block.
 *
 * @author Ben
 *
 */
public class Recording implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int rows;
	private final int cols;
	private final int timesteps;
	private final int trials;
	private final double[] samples;

	public Recording(int rows, int cols, int timesteps, int trials) {
		this(rows, cols, timesteps, trials, new double[rows * cols * timesteps * trials]);
	}

	public Recording(int rows, int cols, int timesteps, int trials, double[] samples) {
		if (rows <= 0 || cols <= 0 || timesteps <= 0 || trials <= 0) {
			throw new IllegalArgumentException("Recording dimensions must be positive");
		}
		if (samples.length != rows * cols * timesteps * trials) {
			throw new IllegalArgumentException("Expected " + rows * cols * timesteps * trials + " samples, got "
					+ samples.length);
		}
		this.rows = rows;
		this.cols = cols;
		this.timesteps = timesteps;
		this.trials = trials;
		this.samples = samples;
	}

	/**
	 * Builds a recording from an explicit shape. A rank 3 shape is a single
	 * trial recording.
	 *
	 * @throws InvalidShapeException if the shape has fewer than 3 or more than 4
	 *                               axes, or does not fit the samples
	 */
	public static Recording of(int[] shape, double[] samples) throws InvalidShapeException {
		if (shape.length < 3 || shape.length > 4) {
			throw new InvalidShapeException("Recording must be (row, column, time[, trial])", shape);
		}
		int trials = shape.length == 4 ? shape[3] : 1;
		for (int dim : shape) {
			if (dim <= 0) {
				throw new InvalidShapeException("Dimensions cannot be 0", shape);
			}
		}
		if ((long) shape[0] * shape[1] * shape[2] * trials != samples.length) {
			throw new InvalidShapeException("Shape does not match " + samples.length + " samples", shape);
		}
		return new Recording(shape[0], shape[1], shape[2], trials, samples);
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

	public int getChannels() {
		return this.rows * this.cols;
	}

	public int[] getShape() {
		return new int[] { rows, cols, timesteps, trials };
	}

	// helper function
	public int getLocation(int row, int col, int time, int trial) {
		return ((trial * timesteps + time) * rows + row) * cols + col;
	}

	public int getChannel(int row, int col) {
		return row * cols + col;
	}

	public double get(int row, int col, int time, int trial) {
		return samples[getLocation(row, col, time, trial)];
	}

	public void set(int row, int col, int time, int trial, double val) {
		samples[getLocation(row, col, time, trial)] = val;
	}

	/**
	 * @return the time series of one channel in one trial, as a copy
	 */
	public double[] getTimeSeries(int channel, int trial) {
		double[] series = new double[timesteps];
		int base = trial * timesteps * rows * cols + channel;
		for (int t = 0; t < timesteps; t++) {
			series[t] = samples[base + t * rows * cols];
		}
		return series;
	}

	public void setTimeSeries(int channel, int trial, double[] series) {
		int base = trial * timesteps * rows * cols + channel;
		for (int t = 0; t < timesteps; t++) {
			samples[base + t * rows * cols] = series[t];
		}
	}

	public Recording copy() {
		return new Recording(rows, cols, timesteps, trials, Arrays.copyOf(samples, samples.length));
	}

	@Override
	public String toString() {
		return "Recording [" + rows + " x " + cols + " x " + timesteps + " x " + trials + "]";
	}
}
