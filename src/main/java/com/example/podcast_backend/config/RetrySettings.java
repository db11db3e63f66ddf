package com.example.podcast_backend.config;

import com.example.podcast_backend.util.RetryPolicy;

import java.time.Duration;

/**
 * Bindable retry budget, nested under the properties classes that need one.
 */
public class RetrySettings {
    private int maxAttempts;
    private Duration initialBackoff;
    private Duration maxBackoff;

    public RetrySettings() {
        this(3, Duration.ofMillis(500), Duration.ofSeconds(5));
    }

    public RetrySettings(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(Math.max(1, maxAttempts), initialBackoff, maxBackoff);
    }
}
