package com.example.podcast_backend.exception;

public class RetriesExhaustedException extends RuntimeException {
    private final String operation;
    private final long attempts;

    public RetriesExhaustedException(String operation, long attempts, Throwable lastFailure) {
        super("Retries exhausted op=" + operation + " attempts=" + attempts
                + (lastFailure != null ? " last=" + lastFailure.getMessage() : ""), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public long getAttempts() {
        return attempts;
    }
}
