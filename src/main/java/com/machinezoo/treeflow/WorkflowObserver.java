// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Observers are read-only. They cannot alter state, renderings, or outputs.
 * Exceptions thrown by observers are logged and otherwise ignored.
 * 
 * Methods named will*() may return a completion callback that is invoked when the operation finishes.
 * Returning null means the observer is not interested in completion.
 */
/**
 * Optional listener for lifecycle, render, and action milestones of a workflow tree.
 */
@StubDocs
public interface WorkflowObserver {
	default void sessionBegan(WorkflowSession session) {
	}
	default void sessionEnded(WorkflowSession session) {
	}
	default <S> void initialState(Workflow<S, ?, ?> workflow, S state, WorkflowSession session) {
	}
	default <S, R> Consumer<R> willRender(Workflow<S, ?, R> workflow, S state, WorkflowSession session) {
		return null;
	}
	default <S> void updated(Workflow<S, ?, ?> previous, Workflow<S, ?, ?> current, S state, WorkflowSession session) {
	}
	/*
	 * Called only for actions arriving from outside of the tree (sinks and side effects),
	 * not for actions produced by mapping child output.
	 */
	default <S, O> void actionReceived(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, WorkflowSession session) {
	}
	default <S, O> BiConsumer<S, O> willApplyAction(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, S state, WorkflowSession session) {
		return null;
	}
	default void sideEffectStarted(Object key, WorkflowSession session) {
	}
	default void sideEffectEnded(Object key, WorkflowSession session) {
	}
}
