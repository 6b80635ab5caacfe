package neuropatt;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;

/**
 * Result or failure of one trial task, as returned by a worker.
 */
public class TrialOutcome<T extends Serializable> implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int trial;
	private final T value;
	private final Throwable failure;

	private TrialOutcome(int trial, T value, Throwable failure) {
		this.trial = trial;
		this.value = value;
		this.failure = failure;
	}

	public static <T extends Serializable> TrialOutcome<T> run(TrialTask<T> task, int trial) {
		try {
			return new TrialOutcome<>(trial, task.call(trial), null);
		} catch (Exception e) {
			return new TrialOutcome<>(trial, null, e);
		}
	}

	public int getTrial() {
		return this.trial;
	}

	public T getValue() {
		return this.value;
	}

	public Throwable getFailure() {
		return this.failure;
	}

	/**
	 * Orders the outcomes by trial and either returns all values or throws for
	 * the lowest failing trial. Partial results are discarded on failure.
	 */
	public static <T extends Serializable> List<T> collect(Stage stage, List<TrialOutcome<T>> outcomes)
			throws AnalysisException {
		List<TrialOutcome<T>> sorted = new ArrayList<>(outcomes);
		sorted.sort(Comparator.comparingInt(TrialOutcome::getTrial));
		List<T> values = new ArrayList<>(sorted.size());
		for (TrialOutcome<T> outcome : sorted) {
			Throwable failure = outcome.getFailure();
			if (failure instanceof AnalysisException) {
				throw (AnalysisException) failure;
			} else if (failure != null) {
				throw new AdapterFailureException(stage, outcome.getTrial(), String.valueOf(failure.getMessage()),
						failure);
			}
			values.add(outcome.getValue());
		}
		return values;
	}
}
