// Part of Treeflow
package com.machinezoo.treeflow;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.*;
import com.machinezoo.closeablescope.CloseableScope;
import com.machinezoo.stagean.*;
import com.machinezoo.treeflow.util.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Host owns the root node and the event loop that serializes everything happening in the tree.
 * 
 * Every event (sink invocation, side effect delivery, root update) becomes a step in the queue.
 * Steps are executed one at a time in arrival order. Each applied step is followed by exactly one render pass from the root,
 * so the next step always sees the tree fully re-rendered. Root output, if any, is published once after that render pass.
 * 
 * The loop has no thread of its own. Without executor, whichever thread enqueues the first step drains the queue inline
 * and other threads merely add steps to it. Nested sends from listeners or actions are queued, never reentrant.
 * With executor, draining is submitted to the executor. Either way there is at most one draining thread at any time.
 * 
 * Host is in one of three states: configured, started, and closed. Configuration is frozen once started.
 * Any exception escaping an action or render pass leaves the tree in unknown state, so the whole tree is torn down
 * and the host is closed. The exception is then rethrown to the draining thread.
 */
/**
 * Runs a tree of {@link Workflow}s and publishes its renderings and outputs.
 * 
 * @param <O>
 *            output type of the root workflow
 * @param <R>
 *            rendering type of the root workflow
 */
@StubDocs
public class WorkflowHost<O, R> implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(WorkflowHost.class);
	private static final Timer renderTimer = Metrics.timer("treeflow.host.renders");
	private static final Timer eventTimer = Metrics.timer("treeflow.host.events");
	private static final Counter discardedCounter = Metrics.counter("treeflow.host.discarded");
	private boolean started;
	private boolean closed;
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException("Workflow host cannot be reconfigured after it is started.");
	}
	public synchronized boolean started() {
		return started;
	}
	public synchronized boolean closed() {
		return closed;
	}
	/*
	 * Written before start() under lock and afterwards only by update steps on the event loop.
	 * The queue lock orders both.
	 */
	private Workflow<?, O, R> workflow;
	public WorkflowHost(Workflow<?, O, R> workflow) {
		Objects.requireNonNull(workflow);
		this.workflow = workflow;
		OwnerTrace.of(this)
			.alias("host")
			.tag("root", workflow.getClass().getSimpleName())
			.generateId();
	}
	private Executor executor;
	public synchronized WorkflowHost<O, R> executor(Executor executor) {
		Objects.requireNonNull(executor);
		ensureNotStarted();
		this.executor = executor;
		return this;
	}
	/*
	 * Null means inline draining.
	 */
	public synchronized Executor executor() {
		return executor;
	}
	private final List<WorkflowObserver> observers = new ArrayList<>();
	public synchronized WorkflowHost<O, R> observer(WorkflowObserver observer) {
		Objects.requireNonNull(observer);
		ensureNotStarted();
		observers.add(observer);
		return this;
	}
	public synchronized List<WorkflowObserver> observers() {
		return Collections.unmodifiableList(new ArrayList<>(observers));
	}
	private WorkflowDebugger debugger;
	public synchronized WorkflowHost<O, R> debugger(WorkflowDebugger debugger) {
		Objects.requireNonNull(debugger);
		ensureNotStarted();
		this.debugger = debugger;
		return this;
	}
	public synchronized WorkflowDebugger debugger() {
		return debugger;
	}
	/*
	 * Events that leave all state equal skip the render pass. Outputs are still published.
	 * Equality is judged by equals() on the state objects, so mutable state mutated in place is never detected as change.
	 */
	private boolean renderOnlyIfStateChanged;
	public synchronized WorkflowHost<O, R> renderOnlyIfStateChanged(boolean renderOnlyIfStateChanged) {
		ensureNotStarted();
		this.renderOnlyIfStateChanged = renderOnlyIfStateChanged;
		return this;
	}
	public synchronized boolean renderOnlyIfStateChanged() {
		return renderOnlyIfStateChanged;
	}
	private boolean logging;
	public synchronized WorkflowHost<O, R> logging(boolean logging) {
		ensureNotStarted();
		this.logging = logging;
		return this;
	}
	public synchronized boolean logging() {
		return logging;
	}
	/*
	 * Listeners can be added at any time, including after start. They are called on the event loop.
	 */
	private final List<Consumer<? super R>> renderingListeners = new CopyOnWriteArrayList<>();
	public WorkflowHost<O, R> onRendering(Consumer<? super R> listener) {
		Objects.requireNonNull(listener);
		renderingListeners.add(listener);
		return this;
	}
	private final List<Consumer<? super O>> outputListeners = new CopyOnWriteArrayList<>();
	public WorkflowHost<O, R> onOutput(Consumer<? super O> listener) {
		Objects.requireNonNull(listener);
		outputListeners.add(listener);
		return this;
	}
	/*
	 * Latest published rendering or null before the first render pass completes.
	 */
	private volatile R rendering;
	public R rendering() {
		return rendering;
	}
	private volatile ChainedWorkflowObserver observer = new ChainedWorkflowObserver(Collections.emptyList());
	ChainedWorkflowObserver observer() {
		return observer;
	}
	/*
	 * The host is the parent of the root node. Replacing the root with workflow of another class
	 * is then just an ordinary child replacement.
	 */
	private final ChildRegistry root = new ChildRegistry(this, this, null);
	public WorkflowHost<O, R> start() {
		synchronized (this) {
			if (started)
				return this;
			started = true;
			if (closed)
				return this;
			List<WorkflowObserver> all = new ArrayList<>();
			if (logging)
				all.add(new WorkflowLogger());
			all.addAll(observers);
			observer = new ChainedWorkflowObserver(all);
		}
		enqueue(new Step(this, () -> {
			renderPass(true);
			return Outcome.RENDERED;
		}));
		return this;
	}
	/*
	 * Equivalent to the parent of the root rendering it again with new props.
	 * Before start(), this just replaces the root workflow.
	 */
	public void update(Workflow<?, O, R> workflow) {
		Objects.requireNonNull(workflow);
		synchronized (this) {
			if (!started) {
				this.workflow = workflow;
				return;
			}
		}
		enqueue(new Step(this, () -> {
			this.workflow = workflow;
			replaced = true;
			return Outcome.RENDER;
		}));
	}
	private enum Outcome {
		DISCARDED,
		APPLIED,
		RENDER,
		RENDERED
	}
	private static class Step {
		final Object target;
		final Supplier<Outcome> body;
		Step(Object target, Supplier<Outcome> body) {
			this.target = target;
			this.body = body;
		}
	}
	private final Deque<Step> queue = new ArrayDeque<>();
	private boolean draining;
	private void enqueue(Step step) {
		Executor executor;
		synchronized (this) {
			if (closed) {
				logger.debug("Discarding event for {}, because the host is closed.", step.target);
				discarded();
				return;
			}
			queue.add(step);
			if (draining)
				return;
			draining = true;
			executor = this.executor;
		}
		if (executor == null)
			drain();
		else
			executor.execute(Exceptions.log(logger).runnable(this::drain));
	}
	private void drain() {
		try {
			while (true) {
				Step step;
				synchronized (this) {
					if (closed) {
						draining = false;
						break;
					}
					step = queue.poll();
					if (step == null) {
						draining = false;
						return;
					}
				}
				process(step);
			}
		} catch (Throwable ex) {
			synchronized (this) {
				closed = true;
				draining = false;
				queue.clear();
			}
			logger.debug("Tearing down workflow tree of {} after failure.", this);
			tearDown();
			throw ex;
		}
		/*
		 * Closed while draining. Whoever closed the host left teardown to us.
		 */
		tearDown();
	}
	/*
	 * Reentrant step cannot happen as long as draining is guarded by the queue lock. The check makes sure it stays that way.
	 */
	private boolean processing;
	private boolean changed;
	private O output;
	private void process(Step step) {
		if (processing)
			throw new IllegalStateException("Events must not be applied reentrantly.");
		Span span = GlobalTracer.get().buildSpan("treeflow.event")
			.withTag("component", "treeflow")
			.start();
		OwnerTrace.of(step.target).fill(span);
		Timer.Sample sample = Timer.start(Clock.SYSTEM);
		processing = true;
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			changed = false;
			output = null;
			Outcome outcome = step.body.get();
			if (outcome == Outcome.DISCARDED)
				return;
			if (outcome == Outcome.RENDER || outcome == Outcome.APPLIED && (!renderOnlyIfStateChanged || changed))
				renderPass(false);
			if (output != null) {
				O published = output;
				output = null;
				for (Consumer<? super O> listener : outputListeners)
					Exceptions.log(logger).run(() -> listener.accept(published));
			}
		} finally {
			processing = false;
			sample.stop(eventTimer);
			span.finish();
		}
	}
	/*
	 * Set when update() replaced the root since the last render pass.
	 */
	private boolean replaced;
	private void renderPass(boolean initial) {
		Timer.Sample sample = Timer.start(Clock.SYSTEM);
		boolean update = replaced;
		replaced = false;
		root.begin();
		R rendering = root.render(workflow, "", this::emit, update);
		root.commit();
		sample.stop(renderTimer);
		this.rendering = rendering;
		for (Consumer<? super R> listener : renderingListeners)
			Exceptions.log(logger).run(() -> listener.accept(rendering));
		if (debugger != null) {
			WorkflowSnapshot snapshot = snapshot();
			if (initial)
				Exceptions.log(logger).run(() -> debugger.didEnterInitialState(snapshot));
			else
				Exceptions.log(logger).run(() -> debugger.didUpdate(snapshot));
		}
	}
	private void emit(O output) {
		this.output = output;
	}
	WorkflowSnapshot snapshot() {
		for (WorkflowNode<?, ?, ?> node : root.children())
			return node.snapshot();
		return null;
	}
	/*
	 * Delivery of an external action to a node. The node may be gone by the time the step runs.
	 */
	<S, NO> void deliver(WorkflowNode<S, NO, ?> node, Lifetime lifetime, Supplier<? extends WorkflowAction<S, NO>> action) {
		enqueue(new Step(node, () -> {
			if (lifetime != null && lifetime.ended() || !node.alive()) {
				logger.debug("Discarding stale event for {}.", node.session());
				discarded();
				return Outcome.DISCARDED;
			}
			node.apply(action.get(), true);
			return Outcome.APPLIED;
		}));
	}
	void discarded() {
		discardedCounter.increment();
	}
	void stateChanged() {
		changed = true;
	}
	/*
	 * Thread currently inside some workflow's render(). Sinks must not be invoked from there.
	 * Side effects are started while the parent's render() is still on the stack, so they clear the marker temporarily.
	 */
	private volatile Thread renderer;
	CloseableScope renderScope(boolean rendering) {
		Thread outer = renderer;
		renderer = rendering ? Thread.currentThread() : null;
		return () -> renderer = outer;
	}
	void ensureNotRendering() {
		if (renderer == Thread.currentThread())
			throw new IllegalStateException("Sinks must not be invoked while rendering. Use side effects to send actions from render().");
	}
	private void tearDown() {
		Exceptions.log(logger).run(root::tearDown);
	}
	/*
	 * Idempotent. Pending events are dropped. When called while the loop is draining, the draining thread tears the tree down
	 * after its current step, so this method may return before all lifetimes are ended.
	 */
	@Override
	public void close() {
		synchronized (this) {
			if (closed)
				return;
			closed = true;
			queue.clear();
			if (draining || !started)
				return;
			/*
			 * Holding the draining flag keeps the tree ours while it is being torn down.
			 */
			draining = true;
		}
		try {
			tearDown();
		} finally {
			synchronized (this) {
				draining = false;
			}
		}
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
