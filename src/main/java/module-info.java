// Part of Treeflow
/**
 * Treeflow is a runtime for trees of stateful workflows that render, react to actions, and run side effects.
 * <p>
 * The main package {@link com.machinezoo.treeflow} contains workflows, the host that runs them, and observers.
 * Package {@link com.machinezoo.treeflow.workers} adapts futures, publishers, and polling to workers.
 */
module com.machinezoo.treeflow {
	exports com.machinezoo.treeflow;
	exports com.machinezoo.treeflow.workers;
	exports com.machinezoo.treeflow.util;
	requires com.machinezoo.stagean;
	requires com.machinezoo.noexception;
	requires com.machinezoo.closeablescope;
	requires org.slf4j;
	/*
	 * ListenableFuture appears in public API of ListenableFutureWorker.
	 */
	requires transitive com.google.common;
	requires io.opentracing.api;
	requires io.opentracing.util;
	requires it.unimi.dsi.fastutil;
	requires micrometer.core;
}
