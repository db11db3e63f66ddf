package com.example.podcast_backend.util;

import com.example.podcast_backend.exception.RetriesExhaustedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoundedRetryTest {

    private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));

    @Test
    void retriesUntilTheWorkSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        String result = BoundedRetry.run("flaky", FAST, IllegalStateException.class::isInstance, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("boom " + calls.get());
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void nonRetryableErrorPropagatesOnFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                BoundedRetry.run("bad-input", FAST, IllegalStateException.class::isInstance, () -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("nope");
                }));

        assertThat(ex).hasMessage("nope");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void exhaustedBudgetCarriesAttemptsAndLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        RetriesExhaustedException ex = assertThrows(RetriesExhaustedException.class, () ->
                BoundedRetry.runVoid("always-down", FAST, IllegalStateException.class::isInstance, () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("down");
                }));

        assertThat(calls.get()).isEqualTo(3);
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getOperation()).isEqualTo("always-down");
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("down");
    }

    @Test
    void singleAttemptPolicyDoesNotRetry() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () ->
                BoundedRetry.run("once", RetryPolicy.once(), e -> true, () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("x");
                }));

        assertThat(calls.get()).isEqualTo(1);
    }
}
