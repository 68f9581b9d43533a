// Part of Treeflow
package com.machinezoo.treeflow;

/**
 * Receives snapshots of the whole workflow hierarchy from {@link WorkflowHost}.
 * Both methods are called on the event loop after the render pass completes.
 */
public interface WorkflowDebugger {
	void didEnterInitialState(WorkflowSnapshot snapshot);
	void didUpdate(WorkflowSnapshot snapshot);
}
