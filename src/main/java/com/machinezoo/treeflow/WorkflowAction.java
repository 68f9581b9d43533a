// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.function.*;

/*
 * Actions are the only way to change node state. The runtime applies every delivered action exactly once,
 * synchronously, on the event loop. The action sees the current state and props through ActionContext.
 * 
 * Returning null means no output. Non-null output is handed to the parent in the same step.
 */
/**
 * State transition applied to a workflow node in response to an event.
 * 
 * @param <S>
 *            state type of the target workflow
 * @param <O>
 *            output type of the target workflow
 */
@FunctionalInterface
public interface WorkflowAction<S, O> {
	O apply(ActionContext<S, O> context);
	static <S, O> WorkflowAction<S, O> noAction() {
		return context -> null;
	}
	static <S, O> WorkflowAction<S, O> output(O output) {
		Objects.requireNonNull(output);
		return context -> output;
	}
	static <S, O> WorkflowAction<S, O> state(UnaryOperator<S> mutation) {
		Objects.requireNonNull(mutation);
		return context -> {
			context.state(mutation.apply(context.state()));
			return null;
		};
	}
}
