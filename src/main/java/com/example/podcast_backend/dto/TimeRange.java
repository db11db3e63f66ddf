package com.example.podcast_backend.dto;

/**
 * Half-open range {@code [startMs, endMs)} of kept audio.
 */
public record TimeRange(long startMs, long endMs) {
    public TimeRange {
        if (endMs < startMs) {
            throw new IllegalArgumentException("endMs < startMs: " + startMs + ".." + endMs);
        }
    }

    public long durationMs() {
        return endMs - startMs;
    }
}
