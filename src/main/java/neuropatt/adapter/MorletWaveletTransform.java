package neuropatt.adapter;

import neuropatt.ComplexRecording;
import neuropatt.Recording;

/**
 * Single frequency complex Morlet wavelet transform along the time axis. The
 * wavelet is normalised so that a unit amplitude sinusoid at the centre
 * frequency gives coefficients of magnitude close to 1 away from the edges.
 * Near the edges the wavelet is truncated.
 */
public class MorletWaveletTransform implements TransformAdapter {

	private static final double GAUSSIAN_WIDTH = 3; // standard deviations kept on each side

	@Override
	public ComplexRecording transform(Recording data, double samplingRate, double centerFrequency,
			double bandwidthParam, int timeDim) {
		if (timeDim != 3) {
			throw new IllegalArgumentException("Time must be the third dimension, got " + timeDim);
		}
		if (samplingRate <= 0 || centerFrequency <= 0 || bandwidthParam <= 0) {
			throw new IllegalArgumentException("Sampling rate, centre frequency and wavelet parameter must be positive");
		}
		double[][] kernel = kernel(samplingRate, centerFrequency, bandwidthParam);
		double[] kernelRe = kernel[0];
		double[] kernelIm = kernel[1];
		int half = kernelRe.length / 2;

		int timesteps = data.getTimesteps();
		ComplexRecording coeffs = new ComplexRecording(data.getRows(), data.getCols(), timesteps, data.getTrials());
		for (int trial = 0; trial < data.getTrials(); trial++) {
			for (int row = 0; row < data.getRows(); row++) {
				for (int col = 0; col < data.getCols(); col++) {
					double[] series = data.getTimeSeries(data.getChannel(row, col), trial);
					for (int t = 0; t < timesteps; t++) {
						double re = 0;
						double im = 0;
						for (int k = -half; k <= half; k++) {
							int pos = t - k;
							if (pos < 0 || pos >= timesteps) {
								continue;
							}
							re += series[pos] * kernelRe[k + half];
							im += series[pos] * kernelIm[k + half];
						}
						coeffs.set(row, col, t, trial, re, im);
					}
				}
			}
		}
		return coeffs;
	}

	/**
	 * @return real and imaginary parts of the sampled wavelet, centred on the
	 *         middle element
	 */
	static double[][] kernel(double samplingRate, double centerFrequency, double bandwidthParam) {
		double sigma = bandwidthParam / (2 * Math.PI * centerFrequency); // seconds
		int half = Math.max(1, (int) Math.ceil(GAUSSIAN_WIDTH * sigma * samplingRate));
		double[] re = new double[2 * half + 1];
		double[] im = new double[2 * half + 1];
		double norm = 0;
		for (int k = -half; k <= half; k++) {
			double time = k / samplingRate;
			double gauss = Math.exp(-time * time / (2 * sigma * sigma));
			re[k + half] = gauss * Math.cos(2 * Math.PI * centerFrequency * time);
			im[k + half] = gauss * Math.sin(2 * Math.PI * centerFrequency * time);
			norm += gauss;
		}
		// a sinusoid of amplitude 1 has analytic amplitude 1/2 per exponential
		double scale = 2 / norm;
		for (int i = 0; i < re.length; i++) {
			re[i] *= scale;
			im[i] *= scale;
		}
		return new double[][] { re, im };
	}
}
