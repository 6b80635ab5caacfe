package neuropatt;

/**
 * Major stages of a pattern analysis run, used to tag progress and failures.
 */
public enum Stage {
	PREPROCESSING("pre-processing"),
	FILTERING("filtering"),
	OPTICAL_FLOW("optical flow"),
	SVD("SVD"),
	PATTERN_DETECTION("pattern detection"),
	TRANSITION_ANALYSIS("transition analysis");

	private final String label;

	Stage(String label) {
		this.label = label;
	}

	@Override
	public String toString() {
		return this.label;
	}
}
