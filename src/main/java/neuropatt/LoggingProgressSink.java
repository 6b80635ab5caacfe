package neuropatt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forwards progress messages to the log at INFO level.
 */
public class LoggingProgressSink implements ProgressSink {

	private static final Logger logger = LogManager.getLogger(LoggingProgressSink.class);

	@Override
	public void report(String message) {
		logger.info(message);
	}
}
