package com.example.podcast_backend.util;

import java.time.Duration;

/**
 * Retry budget for one class of operation.
 *
 * @param maxAttempts    total attempts including the first one, at least 1
 * @param initialBackoff delay before the first retry; doubles on every further retry
 * @param maxBackoff     upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }
}
