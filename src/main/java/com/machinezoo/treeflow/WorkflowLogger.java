// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Lifecycle and actions are logged at debug level. Render passes are far more frequent and go to trace level.
 * Nothing is formatted unless the level is enabled.
 */
/**
 * {@link WorkflowObserver} that writes runtime milestones into SLF4J log.
 */
@StubDocs
public class WorkflowLogger implements WorkflowObserver {
	private static final Logger logger = LoggerFactory.getLogger(WorkflowLogger.class);
	@Override
	public void sessionBegan(WorkflowSession session) {
		logger.debug("Workflow started: {}", session);
	}
	@Override
	public void sessionEnded(WorkflowSession session) {
		logger.debug("Workflow finished: {}", session);
	}
	@Override
	public <S, R> Consumer<R> willRender(Workflow<S, ?, R> workflow, S state, WorkflowSession session) {
		if (!logger.isTraceEnabled())
			return null;
		logger.trace("Rendering {} in state {}", session, state);
		long start = System.nanoTime();
		return rendering -> logger.trace("Rendered {} in {} us", session, (System.nanoTime() - start) / 1000);
	}
	@Override
	public <S, O> void actionReceived(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, WorkflowSession session) {
		logger.debug("Action {} received by {}", action, session);
	}
	@Override
	public <S, O> BiConsumer<S, O> willApplyAction(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, S state, WorkflowSession session) {
		if (!logger.isTraceEnabled())
			return null;
		return (next, output) -> logger.trace("Action applied to {}: state {}, output {}", session, next, output);
	}
	@Override
	public void sideEffectStarted(Object key, WorkflowSession session) {
		logger.debug("Side effect {} started in {}", key, session);
	}
	@Override
	public void sideEffectEnded(Object key, WorkflowSession session) {
		logger.debug("Side effect {} ended in {}", key, session);
	}
}
