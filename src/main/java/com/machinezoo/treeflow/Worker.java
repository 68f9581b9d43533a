// Part of Treeflow
package com.machinezoo.treeflow;

import com.machinezoo.stagean.*;

/*
 * Worker is the abstract "cancellable asynchronous unit of work" capability.
 * Concrete async primitives (futures, publishers, timers, callback APIs) are wrapped by adapters in the workers package.
 * The runtime never depends on any particular async library.
 * 
 * Contract for implementations:
 * - start() must not block. It should hand the work to some executor or callback API and return.
 * - Zero or more values may be sent to the output sink over time, from any thread.
 * - Once the lifetime ends, the work should stop and must not send anything more.
 *   The runtime discards late values anyway, but workers should not rely on that to release resources.
 * - equivalent() decides whether a worker rendered on the next pass is the same logical operation
 *   as the one already running. Equivalent workers are not restarted.
 */
/**
 * Cancellable asynchronous work producing zero or more values.
 * 
 * @param <T>
 *            type of produced values
 */
@StubDocs
public interface Worker<T> {
	void start(Lifetime lifetime, Sink<T> output);
	/*
	 * The other worker is always of the same class as this one. Value equality is the default,
	 * which works well for workers whose fields are their parameters.
	 */
	default boolean equivalent(Worker<T> other) {
		return equals(other);
	}
}
