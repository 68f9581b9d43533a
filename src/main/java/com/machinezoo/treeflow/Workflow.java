// Part of Treeflow
package com.machinezoo.treeflow;

import com.machinezoo.stagean.*;

/*
 * Workflow is an immutable value describing what a node in the tree should be.
 * Its fields are the props supplied by the parent. The runtime keeps state separately in a node
 * and hands it to render(). Workflow instances are replaced on every render pass of the parent,
 * so they should be cheap to construct and free of mutable fields.
 * 
 * Node identity is the concrete workflow class plus the key supplied by the parent.
 * Two different classes never share state even if they are both rendered under the same key.
 */
/**
 * Composable stateful unit of the workflow tree.
 * 
 * @param <S>
 *            state type, owned by the node running this workflow
 * @param <O>
 *            output type, emitted to the parent
 * @param <R>
 *            rendering type, returned to the parent or to the view layer
 */
@StubDocs
public interface Workflow<S, O, R> {
	/*
	 * Called once when the node is created, i.e. when its (class, key) pair first appears in a render pass.
	 */
	S initialState();
	/*
	 * Must not perform I/O. It may run repeatedly for the same state.
	 * All asynchronous work goes through side effects registered in the context.
	 */
	R render(S state, RenderContext<S, O> context);
	/*
	 * Called when the parent renders this workflow again under the same key with possibly new props.
	 * The previous workflow is always of the same class as this one. Default implementation keeps the state.
	 */
	default S update(Workflow<S, O, R> previous, S state) {
		return state;
	}
}
