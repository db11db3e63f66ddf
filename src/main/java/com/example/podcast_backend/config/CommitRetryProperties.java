package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry budgets for database state transitions. The terminal budget guards the single write
 * that marks a job PROCESSED or ERROR and is deliberately larger.
 */
@ConfigurationProperties(prefix = "commit.retry")
public class CommitRetryProperties {
    private RetrySettings intermediate = new RetrySettings(3, Duration.ofMillis(200), Duration.ofSeconds(2));
    private RetrySettings terminal = new RetrySettings(5, Duration.ofSeconds(2), Duration.ofSeconds(30));

    public RetrySettings getIntermediate() {
        return intermediate;
    }

    public void setIntermediate(RetrySettings intermediate) {
        this.intermediate = intermediate;
    }

    public RetrySettings getTerminal() {
        return terminal;
    }

    public void setTerminal(RetrySettings terminal) {
        this.terminal = terminal;
    }
}
