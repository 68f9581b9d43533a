// Part of Treeflow
/*
 * Every adapter guarantees that nothing is sent to the sink after the lifetime ends.
 * Upstream cancellation is best-effort. The runtime discards late deliveries anyway.
 */
/**
 * {@link com.machinezoo.treeflow.Worker} adapters for common asynchronous primitives.
 */
package com.machinezoo.treeflow.workers;
