package neuropatt;

import java.io.Serializable;

/**
 * Work done for one trial. Tasks are shipped to workers, so everything they
 * capture must be serializable.
 */
@FunctionalInterface
public interface TrialTask<T extends Serializable> extends Serializable {

	T call(int trial) throws Exception;
}
