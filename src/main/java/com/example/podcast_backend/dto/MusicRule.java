package com.example.podcast_backend.dto;

import java.util.List;
import java.util.UUID;

/**
 * Background music bed laid under the segments named in {@code applyToSegments}.
 * An empty target list matches no segment.
 */
public record MusicRule(
        UUID musicMediaId,
        List<String> applyToSegments,
        long startOffsetMs,
        long endOffsetMs,
        long fadeInMs,
        long fadeOutMs,
        double volumeDb
) {
    public static final long DEFAULT_FADE_IN_MS = 2000;
    public static final long DEFAULT_FADE_OUT_MS = 3000;
    public static final double DEFAULT_VOLUME_DB = -15.0;

    public MusicRule {
        applyToSegments = applyToSegments == null ? List.of() : List.copyOf(applyToSegments);
        fadeInMs = Math.max(0, fadeInMs);
        fadeOutMs = Math.max(0, fadeOutMs);
    }
}
