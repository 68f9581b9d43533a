// Part of Treeflow
package com.machinezoo.treeflow;

/*
 * The context is valid only while the action is being applied.
 * Actions that capture it and use it later get an exception instead of silently writing into dead state.
 */
/**
 * State and props visible to a {@link WorkflowAction} while it is applied.
 * 
 * @param <S>
 *            state type
 * @param <O>
 *            output type
 */
public final class ActionContext<S, O> {
	private final Workflow<S, O, ?> workflow;
	private S state;
	private boolean closed;
	ActionContext(Workflow<S, O, ?> workflow, S state) {
		this.workflow = workflow;
		this.state = state;
	}
	private void ensureOpen() {
		if (closed)
			throw new IllegalStateException("Action context is only valid while the action is being applied.");
	}
	public S state() {
		ensureOpen();
		return state;
	}
	public void state(S state) {
		ensureOpen();
		this.state = state;
	}
	/*
	 * Current props of the node, i.e. the workflow most recently rendered by the parent.
	 */
	public Workflow<S, O, ?> workflow() {
		ensureOpen();
		return workflow;
	}
	S close() {
		closed = true;
		return state;
	}
}
