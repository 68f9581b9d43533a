// Part of Treeflow
package com.machinezoo.treeflow;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class OutputPropagationTest extends TestBase {
	static class Child implements Workflow<Integer, String, Sink<WorkflowAction<Integer, String>>> {
		@Override
		public Integer initialState() {
			return 0;
		}
		@Override
		public Sink<WorkflowAction<Integer, String>> render(Integer state, RenderContext<Integer, String> context) {
			return context.sink();
		}
	}
	static class Rendering {
		final int received;
		final Sink<WorkflowAction<Integer, String>> child;
		Rendering(int received, Sink<WorkflowAction<Integer, String>> child) {
			this.received = received;
			this.child = child;
		}
	}
	static class Parent implements Workflow<Integer, String, Rendering> {
		final String prefix;
		final boolean listening;
		Parent(String prefix, boolean listening) {
			this.prefix = prefix;
			this.listening = listening;
		}
		@Override
		public Integer initialState() {
			return 0;
		}
		@Override
		public Rendering render(Integer state, RenderContext<Integer, String> context) {
			Sink<WorkflowAction<Integer, String>> child;
			if (listening) {
				child = context.renderChild(new Child(), "child", output -> action -> {
					action.state(action.state() + 1);
					return prefix + output;
				});
			} else
				child = context.renderChild(new Child(), "child");
			return new Rendering(state, child);
		}
	}
	@Test
	public void propagation() {
		List<String> outputs = new ArrayList<>();
		List<Integer> renderings = new ArrayList<>();
		try (WorkflowHost<String, Rendering> host = new WorkflowHost<>(new Parent("parent:", true))
			.onOutput(outputs::add)
			.onRendering(r -> renderings.add(r.received))
			.start()) {
			Sink<WorkflowAction<Integer, String>> child = host.rendering().child;
			// Child output becomes parent action. Parent output reaches the host exactly once.
			child.send(WorkflowAction.output("hi"));
			assertEquals(List.of("parent:hi"), outputs);
			assertEquals(List.of(0, 1), renderings);
			// Event without output produces no output anywhere.
			child.send(WorkflowAction.state(n -> n + 1));
			assertEquals(List.of("parent:hi"), outputs);
			assertEquals(List.of(0, 1, 1), renderings);
			// The output mapping from the latest render pass is used.
			host.update(new Parent("updated:", true));
			child.send(WorkflowAction.output("again"));
			assertEquals(List.of("parent:hi", "updated:again"), outputs);
			assertEquals(2, host.rendering().received);
		}
	}
	@Test
	public void ignored() {
		List<String> outputs = new ArrayList<>();
		List<Integer> renderings = new ArrayList<>();
		try (WorkflowHost<String, Rendering> host = new WorkflowHost<>(new Parent("", false))
			.onOutput(outputs::add)
			.onRendering(r -> renderings.add(r.received))
			.start()) {
			// Output of a child rendered without output mapping is dropped, but the event still causes render pass.
			host.rendering().child.send(WorkflowAction.output("lost"));
			assertEquals(List.of(), outputs);
			assertEquals(List.of(0, 0), renderings);
		}
	}
	static class Grandparent extends StatelessWorkflow<String, Sink<WorkflowAction<Integer, String>>> {
		@Override
		protected Sink<WorkflowAction<Integer, String>> render(RenderContext<Void, String> context) {
			Rendering parent = context.renderChild(new Parent("p:", true), output -> WorkflowAction.output("g:" + output));
			return parent.child;
		}
	}
	@Test
	public void cascade() {
		List<String> outputs = new ArrayList<>();
		try (WorkflowHost<String, Sink<WorkflowAction<Integer, String>>> host = new WorkflowHost<>(new Grandparent()).onOutput(outputs::add).start()) {
			// Output travels up through every level within the same event.
			host.rendering().send(WorkflowAction.output("x"));
			assertEquals(List.of("g:p:x"), outputs);
		}
	}
	static class Labeled implements Workflow<Integer, String, Sink<WorkflowAction<Integer, String>>> {
		final String label;
		Labeled(String label) {
			this.label = label;
		}
		@Override
		public Integer initialState() {
			return 0;
		}
		@Override
		public Sink<WorkflowAction<Integer, String>> render(Integer state, RenderContext<Integer, String> context) {
			return context.sink();
		}
	}
	@Test
	public void props() {
		List<String> seen = new ArrayList<>();
		AtomicReference<ActionContext<Integer, String>> captured = new AtomicReference<>();
		try (WorkflowHost<String, Sink<WorkflowAction<Integer, String>>> host = new WorkflowHost<>(new Labeled("first")).start()) {
			host.update(new Labeled("second"));
			// Actions see props of the latest render pass.
			host.rendering().send(context -> {
				seen.add(((Labeled)context.workflow()).label);
				captured.set(context);
				return null;
			});
			assertEquals(List.of("second"), seen);
			// Action context cannot be used after the action completes.
			assertThrows(IllegalStateException.class, () -> captured.get().state());
			assertThrows(IllegalStateException.class, () -> captured.get().state(5));
		}
	}
}
