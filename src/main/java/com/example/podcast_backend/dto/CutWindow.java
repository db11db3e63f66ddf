package com.example.podcast_backend.dto;

/**
 * Closed interval {@code [startMs, endMs]} to remove. Both boundary milliseconds are cut.
 */
public record CutWindow(long startMs, long endMs) {
    public CutWindow {
        if (startMs < 0) startMs = 0;
        if (endMs < startMs) {
            throw new IllegalArgumentException("cut endMs < startMs: " + startMs + ".." + endMs);
        }
    }
}
