// Part of Treeflow
package com.machinezoo.treeflow;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.junit.jupiter.api.*;
import org.junitpioneer.jupiter.*;
import com.machinezoo.noexception.*;

public class ConcurrencyTest extends TestBase {
	static WorkflowAction<Integer, String> logged(List<String> log, String name) {
		return context -> {
			log.add("apply " + name);
			context.state(context.state() + 1);
			return null;
		};
	}
	@Test
	public void ordering() {
		List<String> log = new ArrayList<>();
		try (WorkflowHost<String, WorkflowHostTest.Counter.Rendering> host = new WorkflowHost<>(new WorkflowHostTest.Counter())
			.onRendering(r -> log.add("render " + r.count))
			.start()) {
			Sink<WorkflowAction<Integer, String>> sink = host.rendering().sink;
			sink.send(context -> {
				log.add("apply 1");
				context.state(context.state() + 1);
				// Events sent while another event is being applied are queued behind it.
				sink.send(logged(log, "2"));
				sink.send(logged(log, "3"));
				log.add("apply 1 done");
				return null;
			});
			// Events are applied in arrival order with complete render pass between them.
			assertEquals(List.of("render 0", "apply 1", "apply 1 done", "render 1", "apply 2", "render 2", "apply 3", "render 3"), log);
		}
	}
	/*
	 * Detects overlapping action applications and render passes anywhere in the tree.
	 */
	static class ExclusionObserver implements WorkflowObserver {
		final AtomicInteger active = new AtomicInteger();
		final AtomicInteger violations = new AtomicInteger();
		final AtomicInteger applied = new AtomicInteger();
		void enter() {
			if (active.incrementAndGet() != 1)
				violations.incrementAndGet();
		}
		@Override
		public <S, R> Consumer<R> willRender(Workflow<S, ?, R> workflow, S state, WorkflowSession session) {
			enter();
			return rendering -> active.decrementAndGet();
		}
		@Override
		public <S, O> BiConsumer<S, O> willApplyAction(WorkflowAction<S, O> action, Workflow<S, O, ?> workflow, S state, WorkflowSession session) {
			enter();
			return (next, output) -> {
				applied.incrementAndGet();
				active.decrementAndGet();
			};
		}
	}
	@RetryingTest(3)
	public void inline() {
		ExclusionObserver observer = new ExclusionObserver();
		AtomicInteger renders = new AtomicInteger();
		ExecutorService senders = Executors.newFixedThreadPool(4);
		try (WorkflowHost<String, WorkflowHostTest.Counter.Rendering> host = new WorkflowHost<>(new WorkflowHostTest.Counter())
			.observer(observer)
			.onRendering(r -> renders.incrementAndGet())
			.start()) {
			Sink<WorkflowAction<Integer, String>> sink = host.rendering().sink;
			// Threads race to drain the loop inline. Only one of them drains at any time.
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < 4; ++t)
				futures.add(senders.submit(() -> {
					for (int i = 0; i < 250; ++i)
						sink.send(WorkflowHostTest.increment());
				}));
			for (Future<?> future : futures)
				Exceptions.sneak().get(future::get);
			await().until(() -> host.rendering().count, equalTo(1000));
			// Exactly one render pass follows every event.
			await().untilAtomic(renders, equalTo(1001));
			assertEquals(1000, observer.applied.get());
			assertEquals(0, observer.violations.get());
		} finally {
			senders.shutdown();
		}
	}
	@RetryingTest(3)
	public void pooled() {
		ExclusionObserver observer = new ExclusionObserver();
		ExecutorService pool = Executors.newFixedThreadPool(4);
		ExecutorService senders = Executors.newFixedThreadPool(4);
		try (WorkflowHost<String, WorkflowHostTest.Counter.Rendering> host = new WorkflowHost<>(new WorkflowHostTest.Counter())
			.executor(pool)
			.observer(observer)
			.start()) {
			await().until(host::rendering, notNullValue());
			Sink<WorkflowAction<Integer, String>> sink = host.rendering().sink;
			// Multi-threaded executor still drains the loop on one thread at a time.
			for (int t = 0; t < 4; ++t)
				senders.submit(() -> {
					for (int i = 0; i < 250; ++i)
						sink.send(WorkflowHostTest.increment());
				});
			await().until(() -> host.rendering().count, equalTo(1000));
			assertEquals(0, observer.violations.get());
		} finally {
			senders.shutdown();
			pool.shutdown();
		}
	}
}
