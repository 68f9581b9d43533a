// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;

/*
 * Fans out notifications to all configured observers in registration order.
 * Completion callbacks run in reverse order, so that the first observer brackets all the others,
 * which is what timing instrumentation needs.
 */
class ChainedWorkflowObserver implements WorkflowObserver {
	private static final Logger logger = LoggerFactory.getLogger(ChainedWorkflowObserver.class);
	private static final ExceptionHandler handler = Exceptions.log(logger);
	private final List<WorkflowObserver> observers;
	ChainedWorkflowObserver(List<WorkflowObserver> observers) {
		this.observers = new ArrayList<>(observers);
	}
	@Override
	public void sessionBegan(WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.sessionBegan(session));
	}
	@Override
	public void sessionEnded(WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.sessionEnded(session));
	}
	@Override
	public <S> void initialState(Workflow<S, ?, ?> workflow, S state, WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.initialState(workflow, state, session));
	}
	@Override
	public <S, R> Consumer<R> willRender(Workflow<S, ?, R> workflow, S state, WorkflowSession session) {
		List<Consumer<R>> callbacks = new ArrayList<>();
		for (WorkflowObserver observer : observers)
			handler.run(() -> {
				Consumer<R> callback = observer.willRender(workflow, state, session);
				if (callback != null)
					callbacks.add(callback);
			});
		if (callbacks.isEmpty())
			return null;
		Collections.reverse(callbacks);
		return rendering -> {
			for (Consumer<R> callback : callbacks)
				handler.run(() -> callback.accept(rendering));
		};
	}
	@Override
	public <S> void updated(Workflow<S, ?, ?> previous, Workflow<S, ?, ?> current, S state, WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.updated(previous, current, state, session));
	}
	@Override
	public <S, O> void actionReceived(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.actionReceived(action, workflow, session));
	}
	@Override
	public <S, O> BiConsumer<S, O> willApplyAction(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, S state, WorkflowSession session) {
		List<BiConsumer<S, O>> callbacks = new ArrayList<>();
		for (WorkflowObserver observer : observers)
			handler.run(() -> {
				BiConsumer<S, O> callback = observer.willApplyAction(action, workflow, state, session);
				if (callback != null)
					callbacks.add(callback);
			});
		if (callbacks.isEmpty())
			return null;
		Collections.reverse(callbacks);
		return (next, output) -> {
			for (BiConsumer<S, O> callback : callbacks)
				handler.run(() -> callback.accept(next, output));
		};
	}
	@Override
	public void sideEffectStarted(Object key, WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.sideEffectStarted(key, session));
	}
	@Override
	public void sideEffectEnded(Object key, WorkflowSession session) {
		for (WorkflowObserver observer : observers)
			handler.run(() -> observer.sideEffectEnded(key, session));
	}
}
