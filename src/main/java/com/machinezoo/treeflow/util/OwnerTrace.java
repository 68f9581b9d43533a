// Part of Treeflow
package com.machinezoo.treeflow.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.google.common.collect.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Workflow trees are deep and events travel through them from the leaves up.
 * A trace span or log line that names only the leaf object is rarely useful.
 * Owner trace attaches alias, tags, and owner (parent) to any object,
 * so that spans and toString() can describe the whole ownership chain, e.g. host.node.node2[key=row-3].
 * 
 * Trace data is kept in a weak-keyed identity map, so objects do not need a dedicated field for it
 * and equals()/hashCode() overrides on workflow types do not interfere.
 * The map value must not reference the target object, otherwise the entry would never be collected.
 * OwnerTrace itself is therefore only a short-lived builder and the data lives in OwnerTraceData.
 */
/**
 * Ownership chain and tags of runtime objects for tracing and debugging.
 */
@NoTests
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	private static final LoadingCache<Object, OwnerTraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(OwnerTraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		Objects.requireNonNull(target);
		return new OwnerTrace<T>(all.getUnchecked(target));
	}
	private final OwnerTraceData data;
	private OwnerTrace(OwnerTraceData data) {
		this.data = data;
	}
	/*
	 * Volatile fields instead of locking. Tags are copied on write, because they are read far more often than written.
	 */
	private static class OwnerTraceData {
		volatile String alias;
		volatile ImmutableMap<String, Object> tags = ImmutableMap.of();
		volatile OwnerTraceData parent;
		OwnerTraceData(Object target) {
			alias = target instanceof Class ? ((Class<?>)target).getSimpleName() : target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Null values are ignored. Setting existing tag replaces its value and keeps its position.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value == null)
			return this;
		synchronized (data) {
			Map<String, Object> copy = new LinkedHashMap<>(data.tags);
			copy.put(key, value);
			data.tags = ImmutableMap.copyOf(copy);
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		if (parent instanceof OwnerTrace)
			data.parent = ((OwnerTrace<?>)parent).data;
		else if (parent == null)
			data.parent = null;
		else
			data.parent = OwnerTrace.of(parent).data;
		return this;
	}
	/*
	 * Namespace name equals the alias unless the alias repeats in the chain, e.g. node, node2, node3 for nested nodes.
	 */
	private static class Namespace {
		OwnerTraceData data;
		String name;
	}
	private List<Namespace> namespaces() {
		List<Namespace> namespaces = new ArrayList<>();
		for (OwnerTraceData ancestor = data; ancestor != null; ancestor = ancestor.parent) {
			Namespace ns = new Namespace();
			ns.data = ancestor;
			namespaces.add(ns);
		}
		Collections.reverse(namespaces);
		Object2IntMap<String> numbering = new Object2IntOpenHashMap<>(namespaces.size());
		for (Namespace ns : namespaces) {
			String alias = ns.data.alias;
			if (!numbering.containsKey(alias)) {
				ns.name = alias;
				numbering.put(alias, 2);
			} else {
				int number = numbering.getInt(alias);
				ns.name = alias + number;
				numbering.put(alias, number + 1);
			}
		}
		return namespaces;
	}
	public Span fill(Span span) {
		Objects.requireNonNull(span);
		List<Namespace> namespaces = namespaces();
		span.setTag("owner", namespaces.stream().map(ns -> ns.name).collect(joining(".")));
		for (Namespace ns : namespaces) {
			for (Map.Entry<String, Object> tag : ns.data.tags.entrySet()) {
				String key = ns.name + "." + tag.getKey();
				Object value = tag.getValue();
				if (value instanceof String)
					span.setTag(key, (String)value);
				else if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
		return span;
	}
	@Override
	public String toString() {
		Map<String, Object> sorted = new TreeMap<>();
		List<Namespace> namespaces = namespaces();
		for (Namespace ns : namespaces)
			ns.data.tags.forEach((key, value) -> sorted.put(ns.name + "." + key, value));
		return namespaces.stream().map(ns -> ns.name).collect(joining(".")) + sorted;
	}
}
