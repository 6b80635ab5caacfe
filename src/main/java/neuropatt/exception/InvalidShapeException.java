package neuropatt.exception;

import java.util.Arrays;

import neuropatt.Stage;

/**
 * Thrown when a recording does not have the (row, column, time[, trial])
 * layout the analysis needs.
 * 
 * @author Ben
 *
 */
public class InvalidShapeException extends AnalysisException {

	private static final long serialVersionUID = 1L;

	public InvalidShapeException() {
		super(Stage.PREPROCESSING, "The Recording Does Not Match The Expected Shape!");
	}

	public InvalidShapeException(String errorMessage) {
		super(Stage.PREPROCESSING, errorMessage);
	}

	public InvalidShapeException(String errorMessage, int[] shape) {
		super(Stage.PREPROCESSING, errorMessage + " (shape " + Arrays.toString(shape) + ")");
	}
}
