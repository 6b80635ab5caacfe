package neuropatt;

import java.io.Serializable;

/**
 * Read-only value made available to every trial task.
 */
@FunctionalInterface
public interface Shared<V> extends Serializable {

	V value();
}
