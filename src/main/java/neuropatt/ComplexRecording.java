package neuropatt;

import java.io.Serializable;

/**
 * Complex valued (row, column, time, trial) tensor holding the time-frequency
 * coefficients of a {@link Recording}. Same layout as the recording.
 *
 * @author Ben
 *
 */
public class ComplexRecording implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int rows;
	private final int cols;
	private final int timesteps;
	private final int trials;
	private final double[] re;
	private final double[] im;

	public ComplexRecording(int rows, int cols, int timesteps, int trials) {
		this(rows, cols, timesteps, trials, new double[rows * cols * timesteps * trials],
				new double[rows * cols * timesteps * trials]);
	}

	public ComplexRecording(int rows, int cols, int timesteps, int trials, double[] re, double[] im) {
		int size = rows * cols * timesteps * trials;
		if (re.length != size || im.length != size) {
			throw new IllegalArgumentException("Expected " + size + " coefficients");
		}
		this.rows = rows;
		this.cols = cols;
		this.timesteps = timesteps;
		this.trials = trials;
		this.re = re;
		this.im = im;
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

	public int getLocation(int row, int col, int time, int trial) {
		return ((trial * timesteps + time) * rows + row) * cols + col;
	}

	public double getReal(int row, int col, int time, int trial) {
		return re[getLocation(row, col, time, trial)];
	}

	public double getImag(int row, int col, int time, int trial) {
		return im[getLocation(row, col, time, trial)];
	}

	public double getAmplitude(int row, int col, int time, int trial) {
		int pos = getLocation(row, col, time, trial);
		return Math.hypot(re[pos], im[pos]);
	}

	public double getPhase(int row, int col, int time, int trial) {
		int pos = getLocation(row, col, time, trial);
		return Math.atan2(im[pos], re[pos]);
	}

	public void set(int row, int col, int time, int trial, double real, double imag) {
		int pos = getLocation(row, col, time, trial);
		re[pos] = real;
		im[pos] = imag;
	}

	/**
	 * @return a single trial recording holding a copy of one trial
	 */
	public ComplexRecording trial(int trial) {
		int size = rows * cols * timesteps;
		double[] trialRe = new double[size];
		double[] trialIm = new double[size];
		System.arraycopy(re, trial * size, trialRe, 0, size);
		System.arraycopy(im, trial * size, trialIm, 0, size);
		return new ComplexRecording(rows, cols, timesteps, 1, trialRe, trialIm);
	}

	/**
	 * Phase angle of every coefficient of one trial, snapshot by snapshot.
	 */
	public double[] phase(int trial) {
		int size = rows * cols * timesteps;
		double[] angle = new double[size];
		int base = trial * size;
		for (int i = 0; i < size; i++) {
			angle[i] = Math.atan2(im[base + i], re[base + i]);
		}
		return angle;
	}
}
