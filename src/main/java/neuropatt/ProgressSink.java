package neuropatt;

/**
 * Receives progress notifications of a running analysis. Implementations must
 * return quickly.
 */
@FunctionalInterface
public interface ProgressSink {

	void report(String message);
}
