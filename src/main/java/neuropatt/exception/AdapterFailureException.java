package neuropatt.exception;

import neuropatt.Stage;

/**
 * An external collaborator (transform, optical flow, pattern extractor, ...)
 * raised or returned an invalid result. Always fatal for the run.
 * 
 * @author Ben
 *
 */
public class AdapterFailureException extends AnalysisException {

	private static final long serialVersionUID = 1L;

	public static final int NO_TRIAL = -1;

	private final int trial;

	public AdapterFailureException(Stage stage, int trial, String errorMessage) {
		super(stage, describe(trial, errorMessage));
		this.trial = trial;
	}

	public AdapterFailureException(Stage stage, int trial, String errorMessage, Throwable err) {
		super(stage, describe(trial, errorMessage), err);
		this.trial = trial;
	}

	/**
	 * @return zero based trial index, or {@link #NO_TRIAL}
	 */
	public int getTrial() {
		return this.trial;
	}

	private static String describe(int trial, String errorMessage) {
		return trial == NO_TRIAL ? errorMessage : "Trial " + trial + ": " + errorMessage;
	}
}
