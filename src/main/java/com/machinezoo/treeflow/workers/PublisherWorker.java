// Part of Treeflow
package com.machinezoo.treeflow.workers;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.treeflow.*;

/*
 * Subscribes to the publisher when started and cancels the subscription when the lifetime ends.
 * All items are requested up front. Items are queued in the host's event loop, which has no backpressure either.
 * 
 * Subscription may arrive after the lifetime already ended. It is cancelled immediately in that case.
 */
/**
 * {@link Worker} that forwards items of a {@link Flow.Publisher}.
 * 
 * @param <T>
 *            type of published items
 */
public class PublisherWorker<T> implements Worker<T> {
	private static final Logger logger = LoggerFactory.getLogger(PublisherWorker.class);
	private final Object parameters;
	public Object parameters() {
		return parameters;
	}
	private final Supplier<? extends Flow.Publisher<? extends T>> supplier;
	public PublisherWorker(Object parameters, Supplier<? extends Flow.Publisher<? extends T>> supplier) {
		Objects.requireNonNull(supplier);
		this.parameters = parameters;
		this.supplier = supplier;
	}
	@Override
	public void start(Lifetime lifetime, Sink<T> output) {
		Flow.Publisher<? extends T> publisher;
		try {
			publisher = supplier.get();
		} catch (Throwable ex) {
			Exceptions.log(logger).handle(ex);
			return;
		}
		AtomicReference<Flow.Subscription> subscription = new AtomicReference<>();
		lifetime.onEnded(() -> {
			Flow.Subscription current = subscription.getAndSet(null);
			if (current != null)
				current.cancel();
		});
		publisher.subscribe(new Flow.Subscriber<T>() {
			@Override
			public void onSubscribe(Flow.Subscription received) {
				subscription.set(received);
				if (lifetime.ended()) {
					if (subscription.compareAndSet(received, null))
						received.cancel();
					return;
				}
				received.request(Long.MAX_VALUE);
			}
			@Override
			public void onNext(T item) {
				if (!lifetime.ended())
					output.send(item);
			}
			@Override
			public void onError(Throwable exception) {
				subscription.set(null);
				if (!lifetime.ended())
					Exceptions.log(logger).handle(exception);
			}
			@Override
			public void onComplete() {
				subscription.set(null);
			}
		});
	}
	@Override
	public boolean equivalent(Worker<T> other) {
		return Objects.equals(parameters, ((PublisherWorker<T>)other).parameters);
	}
	@Override
	public String toString() {
		return "PublisherWorker(" + parameters + ")";
	}
}
