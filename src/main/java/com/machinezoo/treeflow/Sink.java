// Part of Treeflow
package com.machinezoo.treeflow;

/*
 * Sinks are handed out by RenderContext and usually end up embedded in renderings as UI callbacks.
 * They are bound to the node, not to the render pass, so a sink captured by the view layer keeps working
 * after later render passes. Once the node is torn down, values sent to the sink are discarded.
 */
/**
 * Handle that delivers values into the serialized event loop of a {@link WorkflowHost}.
 * 
 * @param <T>
 *            type of delivered values
 */
@FunctionalInterface
public interface Sink<T> {
	/*
	 * Safe to call from any thread. The value is queued and applied on the event loop.
	 */
	void send(T value);
}
