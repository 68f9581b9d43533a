// Part of Treeflow
package com.machinezoo.treeflow;

/**
 * Workflow without state of its own.
 * It can still render children, run side effects, and emit output via sinks.
 * 
 * @param <O>
 *            output type
 * @param <R>
 *            rendering type
 */
public abstract class StatelessWorkflow<O, R> implements Workflow<Void, O, R> {
	@Override
	public final Void initialState() {
		return null;
	}
	@Override
	public final R render(Void state, RenderContext<Void, O> context) {
		return render(context);
	}
	protected abstract R render(RenderContext<Void, O> context);
}
