package neuropatt.exception;

import neuropatt.Stage;

/**
 * Base class of all failures that abort a pattern analysis run.
 * 
 * @author Ben
 *
 */
public class AnalysisException extends Exception {

	private static final long serialVersionUID = 1L;

	private final Stage stage;

	public AnalysisException(Stage stage, String errorMessage) {
		super("[" + stage + "] " + errorMessage);
		this.stage = stage;
	}

	public AnalysisException(Stage stage, String errorMessage, Throwable err) {
		super("[" + stage + "] " + errorMessage, err);
		this.stage = stage;
	}

	public Stage getStage() {
		return this.stage;
	}
}
