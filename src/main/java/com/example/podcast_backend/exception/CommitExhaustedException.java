package com.example.podcast_backend.exception;

/**
 * A database unit-of-work kept failing on transient connectivity errors until its retry budget
 * ran out. Every attempt was rolled back.
 */
public class CommitExhaustedException extends RuntimeException {
    private final long attempts;

    public CommitExhaustedException(String label, long attempts, Throwable cause) {
        super("Commit '" + label + "' failed after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public long getAttempts() {
        return attempts;
    }
}
