// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.concurrent.atomic.*;

/**
 * Identity of one node for the whole of its life, as seen by {@link WorkflowObserver}s.
 * Session begins when the node is created and ends when it is torn down.
 */
public final class WorkflowSession {
	private static final AtomicLong counter = new AtomicLong();
	private final long id = counter.incrementAndGet();
	public long id() {
		return id;
	}
	private final Class<?> type;
	public Class<?> type() {
		return type;
	}
	private final String key;
	public String key() {
		return key;
	}
	private final WorkflowSession parent;
	/*
	 * Null for the root node.
	 */
	public WorkflowSession parent() {
		return parent;
	}
	public boolean root() {
		return parent == null;
	}
	WorkflowSession(Class<?> type, String key, WorkflowSession parent) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(key);
		this.type = type;
		this.key = key;
		this.parent = parent;
	}
	@Override
	public String toString() {
		String local = type.getSimpleName() + (key.isEmpty() ? "" : "[" + key + "]") + "#" + id;
		return parent != null ? parent + "/" + local : local;
	}
}
