// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import com.machinezoo.treeflow.util.*;
import io.micrometer.core.instrument.*;

/*
 * Keyed side effects of one node. Lifecycle follows render passes of the node just like ChildRegistry does for children.
 * 
 * At most one side effect runs under any key. Re-registration with equivalent parameters keeps the running instance.
 * Re-registration with different parameters ends the old lifetime before the new instance is started.
 * Side effects not re-registered in a pass have their lifetime ended in commit(), i.e. before the render pass completes.
 * 
 * New side effects are started in commit() after the node's render() returned, so that the work never observes
 * half-finished render pass and so that an exception thrown by render() does not leave orphaned work behind.
 */
class SideEffectRegistry {
	private static final AtomicInteger running = Metrics.gauge("treeflow.effects.running", new AtomicInteger());
	static class SideEffect {
		final Object key;
		final Object parameters;
		final Lifetime lifetime = new Lifetime();
		final Consumer<Lifetime> action;
		/*
		 * Arbitrary companion object that survives together with the running instance.
		 * Workers keep their latest output mapping here.
		 */
		final Object attachment;
		boolean started;
		boolean ended;
		SideEffect(Object key, Object parameters, Consumer<Lifetime> action, Object attachment) {
			this.key = key;
			this.parameters = parameters;
			this.action = action;
			this.attachment = attachment;
		}
	}
	private final WorkflowHost<?, ?> host;
	private final Object owner;
	private final WorkflowSession session;
	private Map<Object, SideEffect> previous = new LinkedHashMap<>();
	private Map<Object, SideEffect> used = new LinkedHashMap<>();
	private List<SideEffect> pending = new ArrayList<>();
	SideEffectRegistry(WorkflowHost<?, ?> host, Object owner, WorkflowSession session) {
		this.host = host;
		this.owner = owner;
		this.session = session;
	}
	void begin() {
		used = new LinkedHashMap<>();
		pending = new ArrayList<>();
	}
	/*
	 * Returns attachment of the side effect that runs under the key after this call, which may be the already running one.
	 */
	@SuppressWarnings("unchecked")
	<P, A> A register(Object key, P parameters, BiPredicate<? super P, ? super P> equivalence, Consumer<Lifetime> action, A attachment) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(equivalence);
		Objects.requireNonNull(action);
		if (used.containsKey(key))
			throw new IllegalStateException("Side effect key " + key + " was registered twice in one render pass of " + session + ".");
		SideEffect existing = previous.remove(key);
		if (existing != null) {
			if (equivalent(equivalence, (P)existing.parameters, parameters)) {
				used.put(key, existing);
				return (A)existing.attachment;
			}
			end(existing);
		}
		SideEffect fresh = new SideEffect(key, parameters, action, attachment);
		OwnerTrace.of(fresh.lifetime)
			.parent(owner)
			.tag("key", key);
		used.put(key, fresh);
		pending.add(fresh);
		return attachment;
	}
	/*
	 * Exceptions from the equivalence check, including class cast exceptions when incompatible parameters are registered under the same key,
	 * are treated as a change. Restarting the work is always correct while keeping it might not be.
	 */
	private static <P> boolean equivalent(BiPredicate<? super P, ? super P> equivalence, P previous, P next) {
		try {
			return equivalence.test(previous, next);
		} catch (Throwable ex) {
			return false;
		}
	}
	void commit() {
		Map<Object, SideEffect> dropped = previous;
		previous = used;
		used = new LinkedHashMap<>();
		for (SideEffect effect : dropped.values())
			end(effect);
		List<SideEffect> starting = pending;
		pending = new ArrayList<>();
		for (SideEffect effect : starting) {
			effect.started = true;
			running.incrementAndGet();
			host.observer().sideEffectStarted(effect.key, session);
			effect.action.accept(effect.lifetime);
		}
	}
	private void end(SideEffect effect) {
		if (effect.ended)
			return;
		effect.ended = true;
		effect.lifetime.end();
		if (effect.started) {
			running.decrementAndGet();
			host.observer().sideEffectEnded(effect.key, session);
		}
	}
	void tearDown() {
		List<SideEffect> all = new ArrayList<>(used.values());
		all.addAll(previous.values());
		used = new LinkedHashMap<>();
		previous = new LinkedHashMap<>();
		pending = new ArrayList<>();
		for (SideEffect effect : all)
			end(effect);
	}
}
