package neuropatt.adapter;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.Config;
import neuropatt.ProgressSink;
import neuropatt.VelocityField;

/**
 * Singular value decomposition of the velocity fields of all trials, with
 * snapshots as rows and the x and y components of every channel as columns.
 * Reports how much of the variance the dominant modes explain.
 * <p>
 * The complex decomposition works on the real embedding
 * {@code [[X, -Y], [Y, X]]}, whose singular values are those of
 * {@code X + iY}, each twice.
 */
public class SvdModeSummary implements ModeVisualizer {

	private static final Logger logger = LogManager.getLogger(SvdModeSummary.class);

	@Override
	public void visualize(VelocityField field, double samplingRate, Config config, ProgressSink progress) {
		double[] singularValues = singularValues(field, config.useComplexSVD);
		double[] explained = explainedVariance(singularValues);
		if (explained == null) {
			progress.report("Velocity fields are zero everywhere, no SVD modes to show.");
			return;
		}
		int modes = Math.min(config.nSVDmodes, explained.length);
		StringBuilder sb = new StringBuilder("Dominant SVD modes (% variance explained):");
		for (int mode = 0; mode < modes; mode++) {
			sb.append(String.format(" %d: %.1f", mode + 1, 100 * explained[mode]));
		}
		progress.report(sb.toString());
		logger.debug("{} singular values over {} s of data", singularValues.length,
				field.getTimesteps() * field.getTrials() / samplingRate);
	}

	public static double[] singularValues(VelocityField field, boolean complex) {
		int channels = field.getRows() * field.getCols();
		int snapshots = field.getTimesteps() * field.getTrials();
		RealMatrix matrix = complex ? new Array2DRowRealMatrix(2 * snapshots, 2 * channels)
				: new Array2DRowRealMatrix(snapshots, 2 * channels);
		for (int trial = 0; trial < field.getTrials(); trial++) {
			double[] vx = field.real(trial);
			double[] vy = field.imag(trial);
			for (int t = 0; t < field.getTimesteps(); t++) {
				int row = trial * field.getTimesteps() + t;
				for (int channel = 0; channel < channels; channel++) {
					double x = vx[t * channels + channel];
					double y = vy[t * channels + channel];
					if (complex) {
						matrix.setEntry(row, channel, x);
						matrix.setEntry(row, channels + channel, -y);
						matrix.setEntry(snapshots + row, channel, y);
						matrix.setEntry(snapshots + row, channels + channel, x);
					} else {
						matrix.setEntry(row, channel, x);
						matrix.setEntry(row, channels + channel, y);
					}
				}
			}
		}
		double[] values = new SingularValueDecomposition(matrix).getSingularValues();
		if (!complex) {
			return values;
		}
		double[] ret = new double[values.length / 2];
		for (int i = 0; i < ret.length; i++) {
			ret[i] = values[2 * i];
		}
		return ret;
	}

	/**
	 * @return fraction of the total variance per mode, or null if all singular
	 *         values are zero
	 */
	public static double[] explainedVariance(double[] singularValues) {
		double total = 0;
		for (double s : singularValues) {
			total += s * s;
		}
		if (total == 0) {
			return null;
		}
		double[] ret = new double[singularValues.length];
		for (int i = 0; i < ret.length; i++) {
			ret[i] = singularValues[i] * singularValues[i] / total;
		}
		return ret;
	}
}
