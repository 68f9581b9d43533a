// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;

/*
 * Identity of a child node or worker within one parent: concrete class plus the key chosen by the parent.
 */
final class ChildKey {
	private final Class<?> type;
	private final String key;
	ChildKey(Class<?> type, String key) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(key);
		this.type = type;
		this.key = key;
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ChildKey))
			return false;
		ChildKey other = (ChildKey)obj;
		return type == other.type && key.equals(other.key);
	}
	@Override
	public int hashCode() {
		return 31 * type.hashCode() + key.hashCode();
	}
	@Override
	public String toString() {
		return type.getSimpleName() + "[" + key + "]";
	}
}
