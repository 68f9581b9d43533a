// Part of Treeflow
package com.machinezoo.treeflow.workers;

import static org.awaitility.Awaitility.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.treeflow.*;

public class PollingWorkerTest extends TestBase {
	ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
	@AfterEach
	public void shutdown() {
		scheduler.shutdown();
	}
	@Test
	public void polling() {
		AtomicInteger counter = new AtomicInteger();
		PollingWorker<Integer> worker = new PollingWorker<>("counter", Duration.ofMillis(10), scheduler, counter::incrementAndGet);
		WorkflowHost<Void, Integer> host = new WorkflowHost<>(new LatestValueWorkflow<>(worker)).start();
		// Values keep coming until the worker is dropped.
		await().until(host::rendering, greaterThanOrEqualTo(3));
		host.update(new LatestValueWorkflow<>(null));
		settle();
		int stopped = counter.get();
		settle();
		assertEquals(stopped, counter.get());
		host.close();
	}
	@Test
	public void equivalence() {
		PollingWorker<Integer> worker = new PollingWorker<>("a", Duration.ofSeconds(1), scheduler, () -> 1);
		assertTrue(worker.equivalent(new PollingWorker<>("a", Duration.ofSeconds(1), scheduler, () -> 2)));
		assertFalse(worker.equivalent(new PollingWorker<>("a", Duration.ofSeconds(2), scheduler, () -> 1)));
		assertFalse(worker.equivalent(new PollingWorker<>("b", Duration.ofSeconds(1), scheduler, () -> 1)));
		assertThrows(IllegalArgumentException.class, () -> new PollingWorker<>("a", Duration.ZERO, scheduler, () -> 1));
	}
}
