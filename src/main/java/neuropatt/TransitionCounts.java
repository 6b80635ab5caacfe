package neuropatt;

import java.io.Serializable;
import java.util.List;

/**
 * Observed and expected transition counts indexed by
 * [initial type][next type][trial].
 *
 * @author Ben
 *
 */
public class TransitionCounts implements Serializable {

	private static final long serialVersionUID = 1L;

	private final double[][][] observed;
	private final double[][][] expected;

	public TransitionCounts(double[][][] observed, double[][][] expected) {
		if (observed.length != expected.length || observed.length == 0
				|| observed[0].length != expected[0].length
				|| observed[0][0].length != expected[0][0].length) {
			throw new IllegalArgumentException("Observed and expected counts differ in shape");
		}
		this.observed = observed;
		this.expected = expected;
	}

	/**
	 * Stacks per-trial [initial][next] matrices along the trial axis.
	 */
	public static TransitionCounts merge(List<double[][]> observedPerTrial, List<double[][]> expectedPerTrial) {
		int nTrials = observedPerTrial.size();
		int nTypes = observedPerTrial.get(0).length;
		double[][][] observed = new double[nTypes][nTypes][nTrials];
		double[][][] expected = new double[nTypes][nTypes][nTrials];
		for (int trial = 0; trial < nTrials; trial++) {
			for (int i = 0; i < nTypes; i++) {
				for (int j = 0; j < nTypes; j++) {
					observed[i][j][trial] = observedPerTrial.get(trial)[i][j];
					expected[i][j][trial] = expectedPerTrial.get(trial)[i][j];
				}
			}
		}
		return new TransitionCounts(observed, expected);
	}

	public int getTypes() {
		return this.observed.length;
	}

	public int getTrials() {
		return this.observed[0][0].length;
	}

	public double getObserved(int initial, int next, int trial) {
		return this.observed[initial][next][trial];
	}

	public double getExpected(int initial, int next, int trial) {
		return this.expected[initial][next][trial];
	}

	/**
	 * @return trial-wise observed counts of one transition, as a copy
	 */
	public double[] observedAcrossTrials(int initial, int next) {
		return this.observed[initial][next].clone();
	}

	/**
	 * @return trial-wise expected counts of one transition, as a copy
	 */
	public double[] expectedAcrossTrials(int initial, int next) {
		return this.expected[initial][next].clone();
	}
}
