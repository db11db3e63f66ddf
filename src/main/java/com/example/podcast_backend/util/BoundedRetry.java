package com.example.podcast_backend.util;

import com.example.podcast_backend.exception.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry of a blocking unit of work. Shared by the commit layer and the storage fetch path
 * so both follow the same backoff schedule semantics.
 *
 * <p>Errors rejected by {@code retryable} propagate unchanged on the first occurrence. When the
 * budget runs out a {@link RetriesExhaustedException} carrying the last failure is thrown.
 */
public final class BoundedRetry {
    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedRetry.class);

    private BoundedRetry() {
    }

    public static <T> T run(String operation, RetryPolicy policy, Predicate<Throwable> retryable, Supplier<T> work) {
        Mono<T> attempt = Mono.fromSupplier(work);
        if (policy.maxAttempts() <= 1) {
            return attempt.block();
        }
        RetryBackoffSpec spec = Retry.backoff(policy.maxAttempts() - 1L, policy.initialBackoff())
                .maxBackoff(policy.maxBackoff())
                .jitter(0d)
                // retries run blocking JDBC/storage calls
                .scheduler(Schedulers.boundedElastic())
                .filter(retryable)
                .doBeforeRetry(signal -> LOGGER.warn("RETRY op={} failedAttempt={} of={} cause={}",
                        operation, signal.totalRetries() + 1, policy.maxAttempts(), signal.failure().toString()))
                .onRetryExhaustedThrow((s, signal) ->
                        new RetriesExhaustedException(operation, signal.totalRetries() + 1, signal.failure()));
        return attempt.retryWhen(spec).block();
    }

    public static void runVoid(String operation, RetryPolicy policy, Predicate<Throwable> retryable, Runnable work) {
        run(operation, policy, retryable, () -> {
            work.run();
            return null;
        });
    }
}
