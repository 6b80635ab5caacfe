package neuropatt;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import neuropatt.exception.AnalysisException;

/**
 * Runs trials one after another on the calling thread.
 */
public class SequentialTrialExecutor implements TrialExecutor {

	@Override
	public <V extends Serializable> Shared<V> share(V value) {
		return () -> value;
	}

	@Override
	public <T extends Serializable> List<T> map(Stage stage, int trials, TrialTask<T> task) throws AnalysisException {
		List<TrialOutcome<T>> outcomes = new ArrayList<>(trials);
		for (int trial = 0; trial < trials; trial++) {
			TrialOutcome<T> outcome = TrialOutcome.run(task, trial);
			outcomes.add(outcome);
			if (outcome.getFailure() != null) {
				break;
			}
		}
		return TrialOutcome.collect(stage, outcomes);
	}
}
