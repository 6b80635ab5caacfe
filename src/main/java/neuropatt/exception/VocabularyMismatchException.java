package neuropatt.exception;

import java.util.List;

import neuropatt.Stage;

/**
 * A trial reported pattern types that differ from the vocabulary the extractor
 * declared before the run. The vocabularies are never merged.
 * 
 * @author Ben
 *
 */
public class VocabularyMismatchException extends AnalysisException {

	private static final long serialVersionUID = 1L;

	private final int trial;
	private final List<String> expected;
	private final List<String> reported;

	public VocabularyMismatchException(int trial, List<String> expected, List<String> reported) {
		super(Stage.PATTERN_DETECTION, "Trial " + trial + ": pattern types " + reported
				+ " do not match declared types " + expected);
		this.trial = trial;
		this.expected = List.copyOf(expected);
		this.reported = List.copyOf(reported);
	}

	public int getTrial() {
		return this.trial;
	}

	public List<String> getExpected() {
		return this.expected;
	}

	public List<String> getReported() {
		return this.reported;
	}
}
