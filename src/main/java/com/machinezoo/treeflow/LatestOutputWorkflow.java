// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;

/*
 * Adapts a workflow that communicates only through output into one that has a rendering.
 * Child's own rendering is ignored. Rendering of this workflow is the most recent child output
 * or the initial value if the child has not produced any output yet.
 */
/**
 * Renders the latest output of a child workflow.
 * 
 * @param <T>
 *            output type of the child and rendering type of this workflow
 */
public class LatestOutputWorkflow<T> implements Workflow<T, Void, T> {
	private final Workflow<?, T, ?> child;
	public Workflow<?, T, ?> child() {
		return child;
	}
	private final T initial;
	public T initial() {
		return initial;
	}
	public LatestOutputWorkflow(Workflow<?, T, ?> child, T initial) {
		Objects.requireNonNull(child);
		this.child = child;
		this.initial = initial;
	}
	@Override
	public T initialState() {
		return initial;
	}
	@Override
	public T render(T state, RenderContext<T, Void> context) {
		context.renderChild(child, output -> WorkflowAction.<T, Void>state(previous -> output));
		return state;
	}
}
