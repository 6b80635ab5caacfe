package neuropatt;

import java.io.Serializable;
import java.util.List;

/**
 * Patterns of one trial ordered by start time, the matching locations, and
 * the vocabulary the extractor reported for this trial.
 */
public final class TrialPatterns implements Serializable {

	private static final long serialVersionUID = 1L;

	private final List<Pattern> patterns;
	private final List<PatternLocation> locations;
	private final PatternVocabulary vocabulary;

	public TrialPatterns(List<Pattern> patterns, List<PatternLocation> locations, PatternVocabulary vocabulary) {
		if (patterns.size() != locations.size()) {
			throw new IllegalArgumentException(patterns.size() + " patterns but " + locations.size() + " locations");
		}
		this.patterns = List.copyOf(patterns);
		this.locations = List.copyOf(locations);
		this.vocabulary = vocabulary;
	}

	public List<Pattern> getPatterns() {
		return this.patterns;
	}

	public List<PatternLocation> getLocations() {
		return this.locations;
	}

	public PatternVocabulary getVocabulary() {
		return this.vocabulary;
	}
}
