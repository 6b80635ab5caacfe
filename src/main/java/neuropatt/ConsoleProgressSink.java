package neuropatt;

import java.io.PrintStream;

/**
 * Prints progress messages, one per line.
 */
public class ConsoleProgressSink implements ProgressSink {

	private final PrintStream out;

	public ConsoleProgressSink() {
		this(System.out);
	}

	public ConsoleProgressSink(PrintStream out) {
		this.out = out;
	}

	@Override
	public void report(String message) {
		out.println(message);
	}
}
