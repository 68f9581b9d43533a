// Part of Treeflow
package com.machinezoo.treeflow;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.function.*;
import org.junit.jupiter.api.*;

public class WorkflowObserverTest extends TestBase {
	static class Leaf implements Workflow<Integer, Void, Sink<WorkflowAction<Integer, Void>>> {
		@Override
		public Integer initialState() {
			return 0;
		}
		@Override
		public Sink<WorkflowAction<Integer, Void>> render(Integer state, RenderContext<Integer, Void> context) {
			context.runSideEffect("tick", lifetime -> {});
			return context.sink();
		}
	}
	static class Root extends StatelessWorkflow<Void, Sink<WorkflowAction<Integer, Void>>> {
		@Override
		protected Sink<WorkflowAction<Integer, Void>> render(RenderContext<Void, Void> context) {
			return context.renderChild(new Leaf(), "leaf");
		}
	}
	@Test
	public void lifecycle() {
		RecordingObserver observer = new RecordingObserver();
		WorkflowHost<Void, Sink<WorkflowAction<Integer, Void>>> host = new WorkflowHost<>(new Root()).observer(observer).start();
		assertEquals(List.of(
			"began Root",
			"initial Root=null",
			"render Root",
			"began Leaf[leaf]",
			"initial Leaf[leaf]=0",
			"render Leaf[leaf]",
			// Side effects start when the node's render() returns.
			"effect-started Leaf[leaf]:tick",
			"rendered Leaf[leaf]",
			"rendered Root"), observer.events);
		observer.events.clear();
		host.rendering().send(WorkflowAction.state(n -> n + 1));
		assertEquals(List.of(
			"received Leaf[leaf]",
			"apply Leaf[leaf]",
			"applied Leaf[leaf]=1",
			// Root keeps its workflow instance between events, so only the child is updated.
			"render Root",
			"updated Leaf[leaf]",
			"render Leaf[leaf]",
			"rendered Leaf[leaf]",
			"rendered Root"), observer.events);
		observer.events.clear();
		host.close();
		assertEquals(List.of(
			"effect-ended Leaf[leaf]:tick",
			"ended Leaf[leaf]",
			"ended Root"), observer.events);
	}
	@Test
	public void sessions() {
		List<WorkflowSession> sessions = new ArrayList<>();
		WorkflowObserver observer = new WorkflowObserver() {
			@Override
			public void sessionBegan(WorkflowSession session) {
				sessions.add(session);
			}
		};
		try (WorkflowHost<Void, Sink<WorkflowAction<Integer, Void>>> host = new WorkflowHost<>(new Root()).observer(observer).start()) {
			WorkflowSession root = sessions.get(0);
			WorkflowSession leaf = sessions.get(1);
			assertTrue(root.root());
			assertSame(root, leaf.parent());
			assertEquals(Leaf.class, leaf.type());
			assertEquals("leaf", leaf.key());
			assertNotEquals(root.id(), leaf.id());
			assertThat(leaf.toString(), startsWith("Root#" + root.id() + "/Leaf[leaf]#"));
		}
	}
	static class Bracketing implements WorkflowObserver {
		final String name;
		final List<String> log;
		Bracketing(String name, List<String> log) {
			this.name = name;
			this.log = log;
		}
		@Override
		public <S, R> Consumer<R> willRender(Workflow<S, ?, R> workflow, S state, WorkflowSession session) {
			if (!session.root())
				return null;
			log.add(name + " will");
			return rendering -> log.add(name + " done");
		}
	}
	@Test
	public void chaining() {
		List<String> log = new ArrayList<>();
		try (WorkflowHost<Void, Sink<WorkflowAction<Integer, Void>>> host = new WorkflowHost<>(new Root())
			.observer(new Bracketing("first", log))
			.observer(new Bracketing("second", log))
			.start()) {
			// Completion callbacks run in reverse order, so the first observer brackets the others.
			assertEquals(List.of("first will", "second will", "second done", "first done"), log);
			assertEquals(2, host.observers().size());
		}
	}
	@Test
	public void failing() {
		RecordingObserver recording = new RecordingObserver();
		WorkflowObserver failing = new WorkflowObserver() {
			@Override
			public void sessionBegan(WorkflowSession session) {
				throw new IllegalStateException();
			}
			@Override
			public <S, O> BiConsumer<S, O> willApplyAction(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, S state, WorkflowSession session) {
				return (next, output) -> {
					throw new IllegalStateException();
				};
			}
		};
		try (WorkflowHost<Void, Sink<WorkflowAction<Integer, Void>>> host = new WorkflowHost<>(new Root()).observer(failing).observer(recording).start()) {
			// Observer exceptions are logged and have no effect on the tree or on other observers.
			host.rendering().send(WorkflowAction.state(n -> n + 1));
			assertFalse(host.closed());
			assertThat(recording.events, hasItems("began Root", "applied Leaf[leaf]=1"));
		}
	}
	@Test
	public void internal() {
		RecordingObserver observer = new RecordingObserver();
		try (WorkflowHost<String, OutputPropagationTest.Rendering> host = new WorkflowHost<>(new OutputPropagationTest.Parent("", true)).observer(observer).start()) {
			host.rendering().child.send(WorkflowAction.output("x"));
			// Only the action arriving from outside of the tree is reported as received.
			assertThat(observer.events("received"), contains("received Child[child]"));
			assertThat(observer.events("apply"), contains("apply Child[child]", "apply Parent"));
		}
	}
}
