package neuropatt;

import java.io.Serializable;

/**
 * Derived statistics of pattern transitions. The p-value matrices are null
 * when the recording has a single trial.
 *
 * @author Ben
 *
 */
public class TransitionStatistics implements Serializable {

	private static final long serialVersionUID = 1L;

	private final double[][][] rateDiff;
	private final double[][] fractionalChange;
	private final int undefinedCells;
	private final double[][] pValues;
	private final double[][] correctedPValues;

	public TransitionStatistics(double[][][] rateDiff, double[][] fractionalChange, int undefinedCells,
			double[][] pValues, double[][] correctedPValues) {
		this.rateDiff = rateDiff;
		this.fractionalChange = fractionalChange;
		this.undefinedCells = undefinedCells;
		this.pValues = pValues;
		this.correctedPValues = correctedPValues;
	}

	/**
	 * Observed minus expected transitions per second, [initial][next][trial].
	 * Returned as a copy.
	 */
	public double[][][] getRateDiff() {
		double[][][] ret = new double[rateDiff.length][][];
		for (int i = 0; i < rateDiff.length; i++) {
			ret[i] = copy(rateDiff[i]);
		}
		return ret;
	}

	/**
	 * Trial mean of (observed - expected) / expected; NaN where no trial had a
	 * non-zero expected count.
	 */
	public double[][] getFractionalChange() {
		return copy(this.fractionalChange);
	}

	/**
	 * Number of (initial, next, trial) cells skipped because the expected
	 * count was zero.
	 */
	public int getUndefinedCells() {
		return this.undefinedCells;
	}

	public boolean isSignificanceTested() {
		return this.pValues != null;
	}

	public double[][] getPValues() {
		return copy(this.pValues);
	}

	/**
	 * Bonferroni corrected p-values; not clamped to 1.
	 */
	public double[][] getCorrectedPValues() {
		return copy(this.correctedPValues);
	}

	/**
	 * Trial mean of the rate difference of each transition.
	 */
	public double[][] getMeanRateDiff() {
		int nTypes = rateDiff.length;
		double[][] ret = new double[nTypes][nTypes];
		for (int i = 0; i < nTypes; i++) {
			for (int j = 0; j < nTypes; j++) {
				ret[i][j] = TransitionAnalyzer.nanMean(rateDiff[i][j]);
			}
		}
		return ret;
	}

	private static double[][] copy(double[][] matrix) {
		if (matrix == null) {
			return null;
		}
		double[][] ret = new double[matrix.length][];
		for (int i = 0; i < matrix.length; i++) {
			ret[i] = matrix[i].clone();
		}
		return ret;
	}
}
