// Part of Treeflow
package com.machinezoo.treeflow.workers;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.treeflow.*;

/*
 * Polls the supplier with fixed delay, starting immediately. Null results are not delivered.
 * Exceptions thrown by the supplier are logged and polling continues.
 * 
 * Two polling workers are equivalent when they have the same parameters and interval.
 * The supplier and the scheduler are not compared.
 */
/**
 * {@link Worker} that periodically delivers values of a {@link Supplier}.
 * 
 * @param <T>
 *            type of polled values
 */
public class PollingWorker<T> implements Worker<T> {
	private static final Logger logger = LoggerFactory.getLogger(PollingWorker.class);
	private final Object parameters;
	public Object parameters() {
		return parameters;
	}
	private final Duration interval;
	public Duration interval() {
		return interval;
	}
	private final ScheduledExecutorService scheduler;
	private final Supplier<? extends T> supplier;
	public PollingWorker(Object parameters, Duration interval, ScheduledExecutorService scheduler, Supplier<? extends T> supplier) {
		Objects.requireNonNull(interval);
		Objects.requireNonNull(scheduler);
		Objects.requireNonNull(supplier);
		if (interval.isNegative() || interval.isZero())
			throw new IllegalArgumentException("Polling interval must be positive.");
		this.parameters = parameters;
		this.interval = interval;
		this.scheduler = scheduler;
		this.supplier = supplier;
	}
	@Override
	public void start(Lifetime lifetime, Sink<T> output) {
		ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(Exceptions.log(logger).runnable(() -> {
			if (lifetime.ended())
				return;
			T value = supplier.get();
			if (value != null && !lifetime.ended())
				output.send(value);
		}), 0, interval.toNanos(), TimeUnit.NANOSECONDS);
		lifetime.onEnded(() -> future.cancel(false));
	}
	@Override
	public boolean equivalent(Worker<T> other) {
		PollingWorker<T> polling = (PollingWorker<T>)other;
		return Objects.equals(parameters, polling.parameters) && interval.equals(polling.interval);
	}
	@Override
	public String toString() {
		return "PollingWorker(" + parameters + ", " + interval + ")";
	}
}
