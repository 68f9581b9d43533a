// Part of Treeflow
package com.machinezoo.treeflow;

import static java.util.stream.Collectors.*;
import java.util.*;
import com.google.common.collect.*;

/*
 * Immutable value. Children are sorted by key and then by type, so that snapshots do not depend on render order.
 */
/**
 * Description of one node and its descendants at the end of a render pass.
 */
public final class WorkflowSnapshot {
	private final String type;
	public String type() {
		return type;
	}
	private final String key;
	public String key() {
		return key;
	}
	/*
	 * Output of toString() on the node's state.
	 */
	private final String state;
	public String state() {
		return state;
	}
	private final List<WorkflowSnapshot> children;
	public List<WorkflowSnapshot> children() {
		return children;
	}
	public WorkflowSnapshot(String type, String key, String state, List<WorkflowSnapshot> children) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(key);
		Objects.requireNonNull(children);
		this.type = type;
		this.key = key;
		this.state = state;
		this.children = ImmutableList.copyOf(children.stream()
			.sorted(Comparator.comparing(WorkflowSnapshot::key).thenComparing(WorkflowSnapshot::type))
			.collect(toList()));
	}
	public WorkflowSnapshot child(String key) {
		for (WorkflowSnapshot child : children)
			if (child.key.equals(key))
				return child;
		return null;
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof WorkflowSnapshot))
			return false;
		WorkflowSnapshot other = (WorkflowSnapshot)obj;
		return type.equals(other.type) && key.equals(other.key) && Objects.equals(state, other.state) && children.equals(other.children);
	}
	@Override
	public int hashCode() {
		return Objects.hash(type, key, state, children);
	}
	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		format(builder, 0);
		return builder.toString();
	}
	private void format(StringBuilder builder, int depth) {
		for (int i = 0; i < depth; ++i)
			builder.append("  ");
		builder.append(type);
		if (!key.isEmpty())
			builder.append('[').append(key).append(']');
		builder.append(": ").append(state).append('\n');
		for (WorkflowSnapshot child : children)
			child.format(builder, depth + 1);
	}
}
