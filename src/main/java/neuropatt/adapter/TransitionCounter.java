package neuropatt.adapter;

import java.util.List;

import neuropatt.TransitionCounts;
import neuropatt.TrialPatterns;

/**
 * Counts how often one pattern type is followed by another, and how often
 * that would be expected from the base rates of the types alone.
 */
public interface TransitionCounter {

	/**
	 * @param windowAfter  steps searched after a pattern ends
	 * @param windowBefore steps before a pattern ends at which a following
	 *                     pattern may already start
	 */
	TransitionCounts countTransitions(List<TrialPatterns> patternsPerTrial, int nTypes, int totalTimesteps,
			int windowAfter, int windowBefore);
}
