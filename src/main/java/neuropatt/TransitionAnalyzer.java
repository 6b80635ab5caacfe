package neuropatt;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.adapter.PairedSignificanceTest;
import neuropatt.adapter.TransitionCounter;
import neuropatt.exception.AdapterFailureException;

/**
 * Compares observed pattern transitions with the counts expected from the
 * base rates of the pattern types.
 *
 * @author Ben
 *
 */
public class TransitionAnalyzer {

	private static final Logger logger = LogManager.getLogger(TransitionAnalyzer.class);

	private final TransitionCounter counter;
	private final PairedSignificanceTest significanceTest;

	public TransitionAnalyzer(TransitionCounter counter, PairedSignificanceTest significanceTest) {
		this.counter = counter;
		this.significanceTest = significanceTest;
	}

	/**
	 * Counts transitions with search windows derived from the sampling rate.
	 */
	public TransitionCounts count(List<TrialPatterns> patternsPerTrial, int nTypes, int totalTimesteps,
			double samplingRate, Config config) throws AdapterFailureException {
		int windowAfter = config.transitionWindowAfter(samplingRate);
		int windowBefore = config.transitionWindowBefore(samplingRate);
		logger.debug("Searching {} steps after and {} steps before each pattern end", windowAfter, windowBefore);
		TransitionCounts counts;
		try {
			counts = counter.countTransitions(patternsPerTrial, nTypes, totalTimesteps, windowAfter, windowBefore);
		} catch (RuntimeException e) {
			throw new AdapterFailureException(Stage.TRANSITION_ANALYSIS, AdapterFailureException.NO_TRIAL,
					"transition counting failed: " + e.getMessage(), e);
		}
		if (counts == null || counts.getTypes() != nTypes || counts.getTrials() != patternsPerTrial.size()) {
			throw new AdapterFailureException(Stage.TRANSITION_ANALYSIS, AdapterFailureException.NO_TRIAL,
					"transition counts do not cover " + nTypes + " types and " + patternsPerTrial.size() + " trials");
		}
		return counts;
	}

	public TransitionStatistics analyze(TransitionCounts counts, int totalTimesteps, double samplingRate) {
		int nTypes = counts.getTypes();
		int nTrials = counts.getTrials();

		double[][][] rateDiff = new double[nTypes][nTypes][nTrials];
		double[][] fractionalChange = new double[nTypes][nTypes];
		int undefined = 0;
		for (int i = 0; i < nTypes; i++) {
			for (int j = 0; j < nTypes; j++) {
				double[] change = new double[nTrials];
				for (int trial = 0; trial < nTrials; trial++) {
					double obs = counts.getObserved(i, j, trial);
					double exp = counts.getExpected(i, j, trial);
					rateDiff[i][j][trial] = rateDiff(obs, exp, totalTimesteps, samplingRate);
					if (exp == 0) {
						change[trial] = Double.NaN;
						undefined++;
					} else {
						change[trial] = (obs - exp) / exp;
					}
				}
				fractionalChange[i][j] = nanMean(change);
			}
		}
		if (undefined > 0) {
			logger.debug("{} transition cells have no expected count, left out of the fractional change", undefined);
		}

		double[][] pValues = null;
		double[][] corrected = null;
		if (nTrials > 1) {
			pValues = new double[nTypes][nTypes];
			corrected = new double[nTypes][nTypes];
			int comparisons = nTypes * nTypes;
			for (int initPatt = 0; initPatt < nTypes; initPatt++) {
				for (int nextPatt = 0; nextPatt < nTypes; nextPatt++) {
					double p = significanceTest.pValue(counts.observedAcrossTrials(initPatt, nextPatt),
							counts.expectedAcrossTrials(initPatt, nextPatt));
					pValues[initPatt][nextPatt] = p;
					corrected[initPatt][nextPatt] = p * comparisons;
				}
			}
		} else {
			logger.info("Single trial, skipping paired significance tests");
		}
		return new TransitionStatistics(rateDiff, fractionalChange, undefined, pValues, corrected);
	}

	/**
	 * Transition rate difference in events per second.
	 */
	public static double rateDiff(double observed, double expected, int totalTimesteps, double samplingRate) {
		return (observed - expected) / totalTimesteps * samplingRate;
	}

	/**
	 * Mean of the defined values; NaN if there are none.
	 */
	public static double nanMean(double[] values) {
		double sum = 0;
		int n = 0;
		for (double val : values) {
			if (!Double.isNaN(val)) {
				sum += val;
				n++;
			}
		}
		return n == 0 ? Double.NaN : sum / n;
	}
}
