package com.example.podcast_backend.dto;

import java.nio.file.Path;
import java.util.List;

/**
 * A segment positioned on the episode timeline. {@code keep} are ranges of the source file, played
 * back to back starting at {@code startMs}.
 */
public record Placement(String segmentType, Path source, long startMs, List<TimeRange> keep) {
    public Placement {
        keep = List.copyOf(keep);
    }

    public long durationMs() {
        return keep.stream().mapToLong(TimeRange::durationMs).sum();
    }

    public long endMs() {
        return startMs + durationMs();
    }
}
