// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.function.*;

/*
 * Tree diff for the children of one node (or of the host, which has the root node as its only child).
 * 
 * Every render pass of the owner starts with begin() and ends with commit().
 * In between, render() is called once for every child the owner renders.
 * Children found in the previous pass under the same (class, key) are reused and their state is migrated via update().
 * Children not found are created. Children from the previous pass that were not rendered again are torn down in commit().
 * 
 * Nodes are stored type-erased. The class in ChildKey guarantees the unchecked casts are safe.
 */
class ChildRegistry {
	private final WorkflowHost<?, ?> host;
	private final Object owner;
	private final WorkflowSession session;
	private Map<ChildKey, WorkflowNode<?, ?, ?>> previous = new LinkedHashMap<>();
	private Map<ChildKey, WorkflowNode<?, ?, ?>> used = new LinkedHashMap<>();
	/*
	 * The session is null when the registry belongs to the host.
	 */
	ChildRegistry(WorkflowHost<?, ?> host, Object owner, WorkflowSession session) {
		this.host = host;
		this.owner = owner;
		this.session = session;
	}
	void begin() {
		used = new LinkedHashMap<>();
	}
	<S, O, R> R render(Workflow<S, O, R> workflow, String key, Consumer<? super O> onOutput) {
		return render(workflow, key, onOutput, true);
	}
	/*
	 * The host passes false when the root was not replaced since the last pass, so that internal events do not look like new props.
	 */
	@SuppressWarnings("unchecked")
	<S, O, R> R render(Workflow<S, O, R> workflow, String key, Consumer<? super O> onOutput, boolean update) {
		Objects.requireNonNull(workflow);
		Objects.requireNonNull(key);
		Objects.requireNonNull(onOutput);
		ChildKey id = new ChildKey(workflow.getClass(), key);
		if (used.containsKey(id))
			throw new IllegalStateException("Child workflows of the same type must have unique keys. Duplicate " + id + " rendered by " + (session != null ? session : "host") + ".");
		WorkflowNode<S, O, R> node = (WorkflowNode<S, O, R>)previous.remove(id);
		boolean reused = node != null;
		if (!reused)
			node = new WorkflowNode<>(host, workflow, key, session, owner);
		/*
		 * Registered before update and render, so that teardown after a failed pass reaches this child too.
		 */
		used.put(id, node);
		if (reused && update)
			node.update(workflow);
		node.onOutput(onOutput);
		return node.render();
	}
	void commit() {
		Map<ChildKey, WorkflowNode<?, ?, ?>> dropped = previous;
		previous = used;
		used = new LinkedHashMap<>();
		for (WorkflowNode<?, ?, ?> node : dropped.values())
			node.tearDown();
	}
	/*
	 * Covers both maps, because teardown may happen in the middle of a failed render pass.
	 */
	void tearDown() {
		List<WorkflowNode<?, ?, ?>> all = new ArrayList<>(used.values());
		all.addAll(previous.values());
		used = new LinkedHashMap<>();
		previous = new LinkedHashMap<>();
		for (WorkflowNode<?, ?, ?> node : all)
			node.tearDown();
	}
	/*
	 * Children of the last completed render pass.
	 */
	Collection<WorkflowNode<?, ?, ?>> children() {
		return Collections.unmodifiableCollection(previous.values());
	}
}
