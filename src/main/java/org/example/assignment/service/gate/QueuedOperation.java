package org.example.assignment.service.gate;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Deferred unit of work held by a {@link ReadinessGate} until it runs or its deadline passes.
 * Whoever completes {@code result} first wins; later completions are ignored.
 */
record QueuedOperation<T>(
        String id,
        Supplier<CompletableFuture<T>> operation,
        Instant enqueuedAt,
        Duration timeout,
        CompletableFuture<T> result
) {

    static <T> QueuedOperation<T> of(
            String id,
            Supplier<CompletableFuture<T>> operation,
            Instant enqueuedAt,
            Duration timeout) {
        return new QueuedOperation<>(id, operation, enqueuedAt, timeout, new CompletableFuture<>());
    }
}
