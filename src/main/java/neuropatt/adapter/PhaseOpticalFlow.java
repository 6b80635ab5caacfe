package neuropatt.adapter;

import java.util.BitSet;

import neuropatt.ComplexRecording;
import neuropatt.FlowResult;

/**
 * Horn-Schunck optical flow between consecutive snapshots of complex
 * coefficients. By default the phase drives the estimate (wrapped phase
 * differences replace intensity derivatives), otherwise the amplitude. The
 * data term uses a Charbonnier penalty with constant {@code beta}; the
 * smoothness term is weighted by {@code alpha}. Each snapshot pair starts from
 * the solution of the previous one.
 *
 * @author Ben
 *
 */
public class PhaseOpticalFlow implements OpticalFlowAdapter {

	private static final long serialVersionUID = 1L;

	private final int maxIterations;
	private final double tolerance;

	public PhaseOpticalFlow(int maxIterations, double tolerance) {
		if (maxIterations < 1 || tolerance <= 0) {
			throw new IllegalArgumentException("maxIterations must be >= 1 and tolerance > 0");
		}
		this.maxIterations = maxIterations;
		this.tolerance = tolerance;
	}

	@Override
	public FlowResult estimate(ComplexRecording trial, BitSet badChannels, double alpha, double beta,
			boolean useAmplitude) {
		int rows = trial.getRows();
		int cols = trial.getCols();
		int timesteps = trial.getTimesteps();
		int channels = rows * cols;
		double[][] re = new double[timesteps][channels];
		double[][] im = new double[timesteps][channels];
		for (int t = 0; t < timesteps; t++) {
			for (int row = 0; row < rows; row++) {
				for (int col = 0; col < cols; col++) {
					re[t][row * cols + col] = trial.getReal(row, col, t, 0);
					im[t][row * cols + col] = trial.getImag(row, col, t, 0);
				}
			}
			interpolateBadChannels(re[t], im[t], rows, cols, badChannels);
		}

		double[] vx = new double[channels * (timesteps - 1)];
		double[] vy = new double[channels * (timesteps - 1)];
		double[] steps = new double[timesteps - 1];
		double[] u = new double[channels];
		double[] v = new double[channels];
		double[] ix = new double[channels];
		double[] iy = new double[channels];
		double[] it = new double[channels];
		for (int t = 0; t < timesteps - 1; t++) {
			if (useAmplitude) {
				amplitudeDerivatives(re, im, t, rows, cols, ix, iy, it);
			} else {
				phaseDerivatives(re, im, t, rows, cols, ix, iy, it);
			}
			steps[t] = solve(u, v, ix, iy, it, rows, cols, alpha, beta);
			System.arraycopy(u, 0, vx, t * channels, channels);
			System.arraycopy(v, 0, vy, t * channels, channels);
		}
		return new FlowResult(vx, vy, steps);
	}

	/**
	 * Replaces bad channels by the mean of their valid 4-neighbours, or by zero
	 * when there are none.
	 */
	static void interpolateBadChannels(double[] re, double[] im, int rows, int cols, BitSet badChannels) {
		if (badChannels.isEmpty()) {
			return;
		}
		double[] origRe = re.clone();
		double[] origIm = im.clone();
		int[][] offsets = { { -1, 0 }, { 1, 0 }, { 0, -1 }, { 0, 1 } };
		for (int channel = badChannels.nextSetBit(0); channel >= 0 && channel < rows * cols; channel = badChannels
				.nextSetBit(channel + 1)) {
			int row = channel / cols;
			int col = channel % cols;
			double sumRe = 0;
			double sumIm = 0;
			int n = 0;
			for (int[] offset : offsets) {
				int r = row + offset[0];
				int c = col + offset[1];
				if (r < 0 || r >= rows || c < 0 || c >= cols || badChannels.get(r * cols + c)) {
					continue;
				}
				sumRe += origRe[r * cols + c];
				sumIm += origIm[r * cols + c];
				n++;
			}
			re[channel] = n == 0 ? 0 : sumRe / n;
			im[channel] = n == 0 ? 0 : sumIm / n;
		}
	}

	/**
	 * Wrapped phase derivatives: the angle of z1 * conj(z2) is the phase
	 * difference of z1 and z2 in (-pi, pi].
	 */
	static void phaseDerivatives(double[][] re, double[][] im, int t, int rows, int cols, double[] ix, double[] iy,
			double[] it) {
		for (int row = 0; row < rows; row++) {
			for (int col = 0; col < cols; col++) {
				int pos = row * cols + col;
				it[pos] = phaseDifference(re[t + 1][pos], im[t + 1][pos], re[t][pos], im[t][pos]);
				double dx = 0;
				double dy = 0;
				for (int s = t; s <= t + 1; s++) {
					dx += centralDifference(re[s], im[s], row, col, 0, 1, rows, cols);
					dy += centralDifference(re[s], im[s], row, col, 1, 0, rows, cols);
				}
				ix[pos] = dx / 2;
				iy[pos] = dy / 2;
			}
		}
	}

	private static double centralDifference(double[] re, double[] im, int row, int col, int dRow, int dCol,
			int rows, int cols) {
		int r0 = Math.max(0, row - dRow);
		int c0 = Math.max(0, col - dCol);
		int r1 = Math.min(rows - 1, row + dRow);
		int c1 = Math.min(cols - 1, col + dCol);
		int span = (r1 - r0) + (c1 - c0);
		if (span == 0) {
			return 0;
		}
		int a = r1 * cols + c1;
		int b = r0 * cols + c0;
		return phaseDifference(re[a], im[a], re[b], im[b]) / span;
	}

	static double phaseDifference(double re1, double im1, double re2, double im2) {
		// z1 * conj(z2)
		double re = re1 * re2 + im1 * im2;
		double im = im1 * re2 - re1 * im2;
		return Math.atan2(im, re);
	}

	static void amplitudeDerivatives(double[][] re, double[][] im, int t, int rows, int cols, double[] ix,
			double[] iy, double[] it) {
		double[] amp = new double[rows * cols];
		for (int pos = 0; pos < amp.length; pos++) {
			double a0 = Math.hypot(re[t][pos], im[t][pos]);
			double a1 = Math.hypot(re[t + 1][pos], im[t + 1][pos]);
			amp[pos] = (a0 + a1) / 2;
			it[pos] = a1 - a0;
		}
		for (int row = 0; row < rows; row++) {
			for (int col = 0; col < cols; col++) {
				int left = row * cols + Math.max(0, col - 1);
				int right = row * cols + Math.min(cols - 1, col + 1);
				int up = Math.max(0, row - 1) * cols + col;
				int down = Math.min(rows - 1, row + 1) * cols + col;
				int spanX = Math.min(cols - 1, col + 1) - Math.max(0, col - 1);
				int spanY = Math.min(rows - 1, row + 1) - Math.max(0, row - 1);
				ix[row * cols + col] = spanX == 0 ? 0 : (amp[right] - amp[left]) / spanX;
				iy[row * cols + col] = spanY == 0 ? 0 : (amp[down] - amp[up]) / spanY;
			}
		}
	}

	/**
	 * Iterates until the largest velocity change drops below the tolerance.
	 * {@code u} and {@code v} hold the starting guess and receive the solution.
	 *
	 * @return number of iterations used
	 */
	int solve(double[] u, double[] v, double[] ix, double[] iy, double[] it, int rows, int cols, double alpha,
			double beta) {
		double alpha2 = alpha * alpha;
		double[] uNext = new double[u.length];
		double[] vNext = new double[v.length];
		int iteration = 0;
		while (iteration < maxIterations) {
			iteration++;
			double maxChange = 0;
			for (int row = 0; row < rows; row++) {
				for (int col = 0; col < cols; col++) {
					int pos = row * cols + col;
					double uBar = neighbourMean(u, row, col, rows, cols);
					double vBar = neighbourMean(v, row, col, rows, cols);
					double residual = ix[pos] * uBar + iy[pos] * vBar + it[pos];
					double weight = beta > 0 ? 1 / Math.sqrt(1 + residual * residual / (beta * beta)) : 1;
					double denom = alpha2 + weight * (ix[pos] * ix[pos] + iy[pos] * iy[pos]);
					double update = denom == 0 ? 0 : weight * residual / denom;
					uNext[pos] = uBar - ix[pos] * update;
					vNext[pos] = vBar - iy[pos] * update;
					maxChange = Math.max(maxChange, Math.abs(uNext[pos] - u[pos]));
					maxChange = Math.max(maxChange, Math.abs(vNext[pos] - v[pos]));
				}
			}
			System.arraycopy(uNext, 0, u, 0, u.length);
			System.arraycopy(vNext, 0, v, 0, v.length);
			if (maxChange < tolerance) {
				break;
			}
		}
		return iteration;
	}

	private static double neighbourMean(double[] field, int row, int col, int rows, int cols) {
		double sum = 0;
		int n = 0;
		if (row > 0) {
			sum += field[(row - 1) * cols + col];
			n++;
		}
		if (row < rows - 1) {
			sum += field[(row + 1) * cols + col];
			n++;
		}
		if (col > 0) {
			sum += field[row * cols + col - 1];
			n++;
		}
		if (col < cols - 1) {
			sum += field[row * cols + col + 1];
			n++;
		}
		return n == 0 ? field[row * cols + col] : sum / n;
	}
}
