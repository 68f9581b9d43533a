// Part of Treeflow
package com.machinezoo.treeflow.workers;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.*;
import com.machinezoo.treeflow.*;

/*
 * Future is created lazily in start(), so that rendering the worker repeatedly does not repeat the operation.
 * Identity of the operation is given by explicit parameters, because the supplier is usually a lambda,
 * which has only reference equality.
 * 
 * Failed futures deliver nothing. Workers that can fail should complete with a result object describing the failure.
 */
/**
 * {@link Worker} that delivers the result of a {@link CompletableFuture}.
 * 
 * @param <T>
 *            type of the future's result
 */
public class FutureWorker<T> implements Worker<T> {
	private static final Logger logger = LoggerFactory.getLogger(FutureWorker.class);
	private final Object parameters;
	public Object parameters() {
		return parameters;
	}
	private final Supplier<? extends CompletableFuture<? extends T>> supplier;
	public FutureWorker(Object parameters, Supplier<? extends CompletableFuture<? extends T>> supplier) {
		Objects.requireNonNull(supplier);
		this.parameters = parameters;
		this.supplier = supplier;
	}
	@Override
	public void start(Lifetime lifetime, Sink<T> output) {
		CompletableFuture<? extends T> future;
		try {
			future = supplier.get();
		} catch (Throwable ex) {
			Exceptions.log(logger).handle(ex);
			return;
		}
		lifetime.onEnded(() -> future.cancel(false));
		future.whenComplete((value, exception) -> {
			if (lifetime.ended())
				return;
			if (exception != null)
				Exceptions.log(logger).handle(exception);
			else if (value != null)
				output.send(value);
		});
	}
	@Override
	public boolean equivalent(Worker<T> other) {
		return Objects.equals(parameters, ((FutureWorker<T>)other).parameters);
	}
	@Override
	public String toString() {
		return "FutureWorker(" + parameters + ")";
	}
}
