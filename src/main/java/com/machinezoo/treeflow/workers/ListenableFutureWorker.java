// Part of Treeflow
package com.machinezoo.treeflow.workers;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.util.concurrent.*;
import com.machinezoo.noexception.*;
import com.machinezoo.treeflow.*;

/**
 * {@link Worker} that delivers the result of Guava's {@link ListenableFuture}.
 * Equivalence is decided by parameters just like in {@link FutureWorker}.
 * 
 * @param <T>
 *            type of the future's result
 */
public class ListenableFutureWorker<T> implements Worker<T> {
	private static final Logger logger = LoggerFactory.getLogger(ListenableFutureWorker.class);
	private final Object parameters;
	public Object parameters() {
		return parameters;
	}
	private final Supplier<? extends ListenableFuture<? extends T>> supplier;
	public ListenableFutureWorker(Object parameters, Supplier<? extends ListenableFuture<? extends T>> supplier) {
		Objects.requireNonNull(supplier);
		this.parameters = parameters;
		this.supplier = supplier;
	}
	@Override
	public void start(Lifetime lifetime, Sink<T> output) {
		ListenableFuture<? extends T> future;
		try {
			future = supplier.get();
		} catch (Throwable ex) {
			Exceptions.log(logger).handle(ex);
			return;
		}
		/*
		 * Guava futures may be backed by interruptible tasks. Interrupting is fine, because the result would be discarded anyway.
		 */
		lifetime.onEnded(() -> future.cancel(true));
		Futures.addCallback(future, new FutureCallback<T>() {
			@Override
			public void onSuccess(T value) {
				if (!lifetime.ended() && value != null)
					output.send(value);
			}
			@Override
			public void onFailure(Throwable exception) {
				if (!lifetime.ended())
					Exceptions.log(logger).handle(exception);
			}
		}, MoreExecutors.directExecutor());
	}
	@Override
	public boolean equivalent(Worker<T> other) {
		return Objects.equals(parameters, ((ListenableFutureWorker<T>)other).parameters);
	}
	@Override
	public String toString() {
		return "ListenableFutureWorker(" + parameters + ")";
	}
}
