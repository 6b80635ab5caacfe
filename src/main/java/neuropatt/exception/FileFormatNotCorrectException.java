package neuropatt.exception;

/**
 * Handles all exceptions in reading recording and configuration files
 * 
 * @author Ben
 *
 */
public class FileFormatNotCorrectException extends Exception {

	private static final long serialVersionUID = 1L;

	public FileFormatNotCorrectException() {
		super("File Format Not As Expected!");
	}

	public FileFormatNotCorrectException(String errorMessage) {
		super(errorMessage);
	}

	public FileFormatNotCorrectException(String path, int lineNumber, String errorMessage) {
		super(path + ":" + lineNumber + ": " + errorMessage);
	}

	public FileFormatNotCorrectException(String errorMessage, Throwable err) {
		super(errorMessage, err);
	}

}
