package neuropatt.adapter;

import java.util.ArrayList;
import java.util.List;

import neuropatt.Pattern;
import neuropatt.TransitionCounts;
import neuropatt.TrialPatterns;

/**
 * Pattern B follows pattern A if B starts after A does and no earlier than
 * {@code windowBefore} steps before A ends, and no later than
 * {@code windowAfter} steps after it. Under the null model the starts of type
 * B are spread uniformly over the recording, so A is followed by B with
 * probability {@code n_B * window / totalTimesteps}.
 *
 * @author Ben
 *
 */
public class WindowedTransitionCounter implements TransitionCounter {

	@Override
	public TransitionCounts countTransitions(List<TrialPatterns> patternsPerTrial, int nTypes, int totalTimesteps,
			int windowAfter, int windowBefore) {
		if (totalTimesteps <= 0) {
			throw new IllegalArgumentException("totalTimesteps must be positive");
		}
		List<double[][]> observed = new ArrayList<>(patternsPerTrial.size());
		List<double[][]> expected = new ArrayList<>(patternsPerTrial.size());
		for (TrialPatterns trial : patternsPerTrial) {
			observed.add(countObserved(trial.getPatterns(), nTypes, windowAfter, windowBefore));
			expected.add(countExpected(trial.getPatterns(), nTypes, totalTimesteps, windowAfter + windowBefore + 1));
		}
		return TransitionCounts.merge(observed, expected);
	}

	static double[][] countObserved(List<Pattern> patterns, int nTypes, int windowAfter, int windowBefore) {
		double[][] nobs = new double[nTypes][nTypes];
		for (int a = 0; a < patterns.size(); a++) {
			Pattern first = patterns.get(a);
			for (int b = 0; b < patterns.size(); b++) {
				if (a == b) {
					continue;
				}
				Pattern next = patterns.get(b);
				if (next.getStart() > first.getStart() && next.getStart() >= first.getEnd() - windowBefore
						&& next.getStart() <= first.getEnd() + windowAfter) {
					nobs[first.getType()][next.getType()]++;
				}
			}
		}
		return nobs;
	}

	static double[][] countExpected(List<Pattern> patterns, int nTypes, int totalTimesteps, int window) {
		int[] typeCount = new int[nTypes];
		for (Pattern pattern : patterns) {
			typeCount[pattern.getType()]++;
		}
		double probability = Math.min(1.0, (double) window / totalTimesteps);
		double[][] nexp = new double[nTypes][nTypes];
		for (int i = 0; i < nTypes; i++) {
			for (int j = 0; j < nTypes; j++) {
				int candidates = i == j ? typeCount[j] - 1 : typeCount[j];
				nexp[i][j] = typeCount[i] * Math.max(0, candidates) * probability;
			}
		}
		return nexp;
	}
}
