package com.example.podcast_backend.dto;

import java.util.UUID;

public record MusicOverlay(UUID musicMediaId, long startMs, long endMs, long fadeInMs, long fadeOutMs, double volumeDb) {
    public long durationMs() {
        return endMs - startMs;
    }
}
