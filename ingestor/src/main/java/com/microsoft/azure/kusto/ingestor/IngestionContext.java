// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.exceptions.IngestionCancelledException;
import com.microsoft.azure.kusto.ingestor.utils.Ensure;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation and deadline signal for ingestion calls. One context may be shared by several calls; cancelling it
 * fails every call still in flight with {@link IngestionCancelledException} and disposes the operation it was
 * waiting on.
 */
public class IngestionContext {
    private enum Reason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private final Sinks.One<Reason> done = Sinks.one();
    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private volatile Disposable deadlineTimer;

    private IngestionContext() {
    }

    /**
     * @return a context that is only done once {@link #cancel()} is called
     */
    public static IngestionContext create() {
        return new IngestionContext();
    }

    /**
     * @return a context that is done after {@code timeout}, or when cancelled, whichever comes first
     */
    public static IngestionContext withTimeout(Duration timeout) {
        Ensure.argIsNotNull(timeout, "timeout");
        IngestionContext context = new IngestionContext();
        context.deadlineTimer = Mono.delay(timeout).subscribe(ignored -> context.finish(Reason.DEADLINE_EXCEEDED));
        return context;
    }

    public void cancel() {
        finish(Reason.CANCELLED);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Fails with {@link IngestionCancelledException} if this context is already done.
     */
    public void throwIfCancelled(String operation) {
        Reason current = reason.get();
        if (current != null) {
            throw toException(current, operation);
        }
    }

    /**
     * Races {@code operation} against this context. The returned Mono fails immediately on subscription when the
     * context is already done, without subscribing to {@code operation}.
     */
    public <T> Mono<T> bind(Mono<T> operation, String operationName) {
        return Mono.defer(() -> {
            Reason current = reason.get();
            if (current != null) {
                return Mono.error(toException(current, operationName));
            }

            Mono<T> cancellation = done.asMono().flatMap(r -> Mono.error(toException(r, operationName)));
            return Mono.firstWithSignal(operation, cancellation);
        });
    }

    private void finish(Reason r) {
        if (reason.compareAndSet(null, r)) {
            done.tryEmitValue(r);
            Disposable timer = deadlineTimer;
            if (timer != null) {
                timer.dispose();
            }
        }
    }

    private static IngestionCancelledException toException(Reason r, String operation) {
        return r == Reason.DEADLINE_EXCEEDED
                ? new IngestionCancelledException(operation, operation + ": deadline exceeded", true)
                : new IngestionCancelledException(operation, operation + ": ingestion was cancelled", false);
    }
}
