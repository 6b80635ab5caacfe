package neuropatt;

import java.io.Serializable;
import java.util.List;

import neuropatt.exception.AnalysisException;

/**
 * Schedules independent per-trial work. Trials never see each other's state,
 * so sequential and parallel executors produce the same results.
 */
public interface TrialExecutor {

	/**
	 * Makes a read-only value available to tasks without copying it into every
	 * task.
	 */
	<V extends Serializable> Shared<V> share(V value);

	/**
	 * Runs {@code task} for trials {@code 0 .. trials - 1} and waits for all of
	 * them.
	 *
	 * @return one result per trial, in trial order
	 * @throws AnalysisException for the lowest failing trial; analysis
	 *                           exceptions raised by the task are rethrown as
	 *                           they are, anything else is wrapped in an
	 *                           {@link neuropatt.exception.AdapterFailureException}
	 */
	<T extends Serializable> List<T> map(Stage stage, int trials, TrialTask<T> task) throws AnalysisException;
}
