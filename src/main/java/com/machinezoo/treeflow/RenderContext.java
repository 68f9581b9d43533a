// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Render context exists for exactly one render pass of one node. It is the only way for render()
 * to declare children, sinks, and side effects. Everything declared here is diffed against the previous pass
 * when render() returns.
 * 
 * Sinks obtained from the context outlive it. Everything else fails once the render pass is over,
 * because late declarations would have no pass to be diffed in.
 */
/**
 * Declarations available to {@link Workflow#render(Object, RenderContext)}.
 * 
 * @param <S>
 *            state type of the rendering workflow
 * @param <O>
 *            output type of the rendering workflow
 */
@StubDocs
public final class RenderContext<S, O> {
	private final WorkflowNode<S, O, ?> node;
	private boolean valid = true;
	RenderContext(WorkflowNode<S, O, ?> node) {
		this.node = node;
	}
	void invalidate() {
		valid = false;
	}
	private void ensureValid() {
		if (!valid)
			throw new IllegalStateException("Render context of " + node.session() + " was used after its render pass completed.");
	}
	public WorkflowSession session() {
		return node.session();
	}
	/*
	 * Child output is mapped to an action of this workflow and applied right away,
	 * in the same step as the child's own action.
	 */
	public <CS, CO, CR> CR renderChild(Workflow<CS, CO, CR> child, String key, Function<? super CO, ? extends WorkflowAction<S, O>> outputMap) {
		ensureValid();
		Objects.requireNonNull(child);
		Objects.requireNonNull(key);
		Objects.requireNonNull(outputMap);
		return node.children().render(child, key, output -> node.apply(outputMap.apply(output), false));
	}
	public <CS, CO, CR> CR renderChild(Workflow<CS, CO, CR> child, Function<? super CO, ? extends WorkflowAction<S, O>> outputMap) {
		return renderChild(child, "", outputMap);
	}
	/*
	 * Output of the child is ignored. Child events still cause the render pass that follows every event.
	 */
	public <CS, CO, CR> CR renderChild(Workflow<CS, CO, CR> child, String key) {
		return renderChild(child, key, output -> WorkflowAction.noAction());
	}
	public <CS, CO, CR> CR renderChild(Workflow<CS, CO, CR> child) {
		return renderChild(child, "");
	}
	public Sink<WorkflowAction<S, O>> sink() {
		ensureValid();
		return node.sink();
	}
	/*
	 * Type token only. The returned sink is the node's single sink, so it is equal across render passes.
	 */
	@SuppressWarnings("unchecked")
	public <A extends WorkflowAction<S, O>> Sink<A> sink(Class<A> type) {
		Objects.requireNonNull(type);
		return (Sink<A>)(Sink<?>)sink();
	}
	public <E> Sink<E> sink(Function<? super E, ? extends WorkflowAction<S, O>> mapper) {
		Objects.requireNonNull(mapper);
		Sink<WorkflowAction<S, O>> target = sink();
		return event -> target.send(mapper.apply(event));
	}
	/*
	 * Side effect without parameters. It runs from the first pass that registers the key until the first pass that does not.
	 */
	public void runSideEffect(Object key, Consumer<Lifetime> action) {
		runSideEffect(key, null, (previous, next) -> true, action);
	}
	/*
	 * Parameterized side effect. The equivalence receives parameters of the running instance first and the new parameters second.
	 * Non-equivalent parameters restart the side effect.
	 */
	public <P> void runSideEffect(Object key, P parameters, BiPredicate<? super P, ? super P> equivalence, Consumer<Lifetime> action) {
		ensureValid();
		node.effects().register(key, parameters, equivalence, action, null);
	}
	public <T> void runWorker(Worker<T> worker, String key, Function<? super T, ? extends WorkflowAction<S, O>> outputMap) {
		ensureValid();
		Objects.requireNonNull(worker);
		Objects.requireNonNull(key);
		Objects.requireNonNull(outputMap);
		WorkerRun<S, O, T> candidate = new WorkerRun<>(node, worker, outputMap);
		WorkerRun<S, O, T> active = node.effects().register(
			new ChildKey(worker.getClass(), key),
			worker,
			(previous, next) -> next.equivalent(previous),
			candidate::start,
			candidate);
		active.outputMap = outputMap;
	}
	public <T> void runWorker(Worker<T> worker, Function<? super T, ? extends WorkflowAction<S, O>> outputMap) {
		runWorker(worker, "", outputMap);
	}
	private static class WorkerRun<S, O, T> {
		final WorkflowNode<S, O, ?> node;
		final Worker<T> worker;
		/*
		 * Read when the delivery is applied on the event loop, which is also where it is written.
		 */
		Function<? super T, ? extends WorkflowAction<S, O>> outputMap;
		WorkerRun(WorkflowNode<S, O, ?> node, Worker<T> worker, Function<? super T, ? extends WorkflowAction<S, O>> outputMap) {
			this.node = node;
			this.worker = worker;
			this.outputMap = outputMap;
		}
		void start(Lifetime lifetime) {
			worker.start(lifetime, value -> node.deliver(lifetime, () -> outputMap.apply(value)));
		}
	}
}
