// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.treeflow.util.*;

/*
 * Runtime instance of one workflow. The node owns workflow state, its children, and its side effects.
 * 
 * Lifecycle: created (initialState), then any number of render passes, each possibly preceded by update(),
 * and finally torn down. There is no way back from teardown. Torn down node ignores all further events.
 * 
 * All methods run on the host's event loop. No locking is needed, because the loop is single-threaded
 * and render passes of one node never overlap.
 */
class WorkflowNode<S, O, R> {
	private static final Logger logger = LoggerFactory.getLogger(WorkflowNode.class);
	private final WorkflowHost<?, ?> host;
	private final WorkflowSession session;
	WorkflowSession session() {
		return session;
	}
	private Workflow<S, O, R> workflow;
	Workflow<S, O, R> workflow() {
		return workflow;
	}
	private S state;
	private final ChildRegistry children;
	ChildRegistry children() {
		return children;
	}
	private final SideEffectRegistry effects;
	SideEffectRegistry effects() {
		return effects;
	}
	/*
	 * Where output goes. Parent replaces it on every render pass, so that the latest output mapping is always used.
	 */
	private Consumer<? super O> onOutput = output -> {};
	void onOutput(Consumer<? super O> onOutput) {
		this.onOutput = onOutput;
	}
	WorkflowNode(WorkflowHost<?, ?> host, Workflow<S, O, R> workflow, String key, WorkflowSession parent, Object owner) {
		this.host = host;
		this.workflow = workflow;
		session = new WorkflowSession(workflow.getClass(), key, parent);
		OwnerTrace.of(this)
			.alias("node")
			.parent(owner)
			.tag("type", workflow.getClass().getSimpleName())
			.tag("key", key.isEmpty() ? null : key);
		children = new ChildRegistry(host, this, session);
		effects = new SideEffectRegistry(host, this, session);
		host.observer().sessionBegan(session);
		state = workflow.initialState();
		host.observer().initialState(workflow, state, session);
	}
	private boolean alive = true;
	boolean alive() {
		return alive;
	}
	R render() {
		if (!alive)
			throw new IllegalStateException("Cannot render torn down workflow " + session + ".");
		Consumer<R> completion = host.observer().willRender(workflow, state, session);
		RenderContext<S, O> context = new RenderContext<>(this);
		children.begin();
		effects.begin();
		R rendering;
		try (CloseableScope scope = host.renderScope(true)) {
			rendering = workflow.render(state, context);
		} finally {
			context.invalidate();
		}
		try (CloseableScope scope = host.renderScope(false)) {
			children.commit();
			effects.commit();
		}
		if (completion != null)
			completion.accept(rendering);
		return rendering;
	}
	void update(Workflow<S, O, R> next) {
		Workflow<S, O, R> previous = workflow;
		state = next.update(previous, state);
		workflow = next;
		host.observer().updated(previous, next, state, session);
	}
	/*
	 * Applies the action synchronously. Output, if any, is handed to the parent immediately,
	 * so the whole cascade up the tree completes within one step of the event loop.
	 */
	void apply(WorkflowAction<S, O> action, boolean external) {
		Objects.requireNonNull(action);
		if (!alive) {
			logger.debug("Discarding action {} sent to torn down workflow {}.", action, session);
			host.discarded();
			return;
		}
		if (external)
			host.observer().actionReceived(action, workflow, session);
		BiConsumer<S, O> completion = host.observer().willApplyAction(action, workflow, state, session);
		ActionContext<S, O> context = new ActionContext<>(workflow, state);
		O output;
		S next;
		try {
			output = action.apply(context);
		} finally {
			next = context.close();
		}
		if (changed(state, next))
			host.stateChanged();
		state = next;
		if (completion != null)
			completion.accept(state, output);
		if (output != null)
			onOutput.accept(output);
	}
	/*
	 * Application-defined equals() may throw. Assuming change is the safe fallback.
	 */
	private static boolean changed(Object previous, Object next) {
		if (previous == next)
			return false;
		try {
			return !Objects.equals(previous, next);
		} catch (Throwable ex) {
			return true;
		}
	}
	/*
	 * Sinks of one node are all the same object, so that renderings embedding them compare equal across passes.
	 */
	private final Sink<WorkflowAction<S, O>> sink = new NodeSink();
	Sink<WorkflowAction<S, O>> sink() {
		return sink;
	}
	private class NodeSink implements Sink<WorkflowAction<S, O>> {
		@Override
		public void send(WorkflowAction<S, O> action) {
			Objects.requireNonNull(action);
			host.ensureNotRendering();
			host.deliver(WorkflowNode.this, null, () -> action);
		}
		@Override
		public String toString() {
			return "sink of " + session;
		}
	}
	/*
	 * Delivery from a side effect. The action is resolved on the event loop, so that it can use the latest output mapping.
	 */
	void deliver(Lifetime lifetime, Supplier<? extends WorkflowAction<S, O>> action) {
		if (lifetime.ended()) {
			logger.debug("Discarding delivery from ended side effect {} of {}.", lifetime, session);
			host.discarded();
			return;
		}
		host.deliver(this, lifetime, action);
	}
	void tearDown() {
		if (!alive)
			return;
		alive = false;
		effects.tearDown();
		children.tearDown();
		host.observer().sessionEnded(session);
	}
	WorkflowSnapshot snapshot() {
		List<WorkflowSnapshot> nested = new ArrayList<>();
		for (WorkflowNode<?, ?, ?> child : children.children())
			nested.add(child.snapshot());
		return new WorkflowSnapshot(workflow.getClass().getName(), session.key(), String.valueOf(state), nested);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
