// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.ingestor;

import com.microsoft.azure.kusto.ingestor.exceptions.IngestionCancelledException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionContextTest {

    @Test
    void bind_PassesValueThrough() {
        StepVerifier.create(IngestionContext.create().bind(Mono.just("value"), "op"))
                .expectNext("value")
                .verifyComplete();
    }

    @Test
    void bind_AlreadyCancelled_DoesNotSubscribeOperation() {
        AtomicBoolean subscribed = new AtomicBoolean();
        IngestionContext context = IngestionContext.create();
        context.cancel();

        StepVerifier.create(context.bind(Mono.fromCallable(() -> subscribed.getAndSet(true)), "op"))
                .expectErrorMatches(e -> e instanceof IngestionCancelledException && !((IngestionCancelledException) e).isDeadlineExceeded())
                .verify();
        assertFalse(subscribed.get());
    }

    @Test
    void bind_CancelledWhileRunning_DisposesOperation() {
        AtomicBoolean disposed = new AtomicBoolean();
        IngestionContext context = IngestionContext.create();

        StepVerifier.create(context.bind(Mono.never().doOnCancel(() -> disposed.set(true)), "op"))
                .expectSubscription()
                .then(context::cancel)
                .expectError(IngestionCancelledException.class)
                .verify(Duration.ofSeconds(5));
        assertTrue(disposed.get());
    }

    @Test
    void withTimeout_DeadlineExceeded() {
        IngestionContext context = IngestionContext.withTimeout(Duration.ofMillis(50));

        StepVerifier.create(context.bind(Mono.never(), "op"))
                .expectErrorMatches(e -> e instanceof IngestionCancelledException && ((IngestionCancelledException) e).isDeadlineExceeded())
                .verify(Duration.ofSeconds(5));
        assertTrue(context.isCancelled());
    }

    @Test
    void throwIfCancelled() {
        IngestionContext context = IngestionContext.create();
        assertDoesNotThrow(() -> context.throwIfCancelled("op"));

        context.cancel();
        context.cancel();

        assertThrows(IngestionCancelledException.class, () -> context.throwIfCancelled("op"));
    }
}
