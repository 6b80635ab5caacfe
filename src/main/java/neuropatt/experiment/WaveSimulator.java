package neuropatt.experiment;

import java.util.Random;

import neuropatt.Recording;

/**
 * Generates recordings of oscillations that alternate between a plane wave
 * travelling along the columns and a wave rotating around the grid centre.
 *
 * @author Ben
 *
 */
public class WaveSimulator {

	private final int rows;
	private final int cols;
	private final double samplingRate;
	private final double frequency;
	private final double noise;
	private final Random rand;

	public WaveSimulator(int rows, int cols, double samplingRate, double frequency, double noise, long seed) {
		this.rows = rows;
		this.cols = cols;
		this.samplingRate = samplingRate;
		this.frequency = frequency;
		this.noise = noise;
		this.rand = new Random(seed);
	}

	/**
	 * @param epochLength snapshots per wave type before switching
	 */
	public Recording generate(int timesteps, int trials, int epochLength) {
		Recording recording = new Recording(rows, cols, timesteps, trials);
		double centreRow = (rows - 1) / 2.0;
		double centreCol = (cols - 1) / 2.0;
		double wavenumber = 2 * Math.PI / cols;
		for (int trial = 0; trial < trials; trial++) {
			// trials start in different epochs
			int offset = rand.nextInt(2 * epochLength);
			for (int t = 0; t < timesteps; t++) {
				boolean rotating = ((t + offset) / epochLength) % 2 == 1;
				double phase = 2 * Math.PI * frequency * t / samplingRate;
				for (int row = 0; row < rows; row++) {
					for (int col = 0; col < cols; col++) {
						double spatial = rotating ? Math.atan2(row - centreRow, col - centreCol) : wavenumber * col;
						double val = Math.cos(phase - spatial) + noise * rand.nextGaussian();
						recording.set(row, col, t, trial, val);
					}
				}
			}
		}
		return recording;
	}
}
