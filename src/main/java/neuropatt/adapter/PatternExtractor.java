package neuropatt.adapter;

import java.io.Serializable;

import neuropatt.Config;
import neuropatt.PatternVocabulary;
import neuropatt.TrialField;
import neuropatt.TrialPatterns;

/**
 * Classifies the velocity field of one trial into typed pattern instances.
 * Instances are shipped to workers, so they must be serializable.
 */
public interface PatternExtractor extends Serializable {

	/**
	 * Pattern types this extractor reports, declared before any trial runs.
	 */
	PatternVocabulary vocabulary();

	/**
	 * @return patterns ordered by start time; the reported vocabulary must be
	 *         {@link #vocabulary()}
	 */
	TrialPatterns findAllPatterns(TrialField field, Config params);
}
