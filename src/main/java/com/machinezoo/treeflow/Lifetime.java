// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;
import com.machinezoo.treeflow.util.*;

/*
 * Lifetime is the cancellation scope of one side effect.
 * The runtime ends it when the side effect's key is dropped from a render pass, when the owning node is torn down,
 * or when the host is closed. Cancellation is cooperative. Work registers callbacks via onEnded() to stop itself.
 * The runtime discards any delivery tagged with an ended lifetime, so late deliveries are harmless.
 * 
 * The sequence is one-way: alive, then ended. Calling end() repeatedly is tolerated.
 */
/**
 * Cancellation scope of a side effect.
 */
@StubDocs
public class Lifetime {
	private static final Logger logger = LoggerFactory.getLogger(Lifetime.class);
	public Lifetime() {
		OwnerTrace.of(this).alias("lifetime");
	}
	private boolean ended;
	public synchronized boolean ended() {
		return ended;
	}
	/*
	 * Callbacks are kept in registration order and each runs exactly once.
	 */
	private List<Runnable> callbacks = new ArrayList<>();
	public void onEnded(Runnable callback) {
		Objects.requireNonNull(callback);
		synchronized (this) {
			if (!ended) {
				callbacks.add(callback);
				return;
			}
		}
		/*
		 * Already ended. Run inline outside of the lock.
		 */
		Exceptions.log(logger).run(callback);
	}
	/*
	 * Normally called only by the runtime. Work that finishes on its own may end its lifetime early,
	 * which makes the runtime ignore anything it delivers afterwards.
	 */
	public void end() {
		List<Runnable> pending;
		synchronized (this) {
			if (ended)
				return;
			ended = true;
			pending = callbacks;
			callbacks = null;
		}
		/*
		 * Callbacks run outside of the lock, because they may block or call back into this lifetime.
		 * Exceptions are logged, so that one faulty callback does not prevent the others from running.
		 */
		for (Runnable callback : pending)
			Exceptions.log(logger).run(callback);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + (ended() ? " (ended)" : "");
	}
}
