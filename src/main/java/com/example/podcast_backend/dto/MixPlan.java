package com.example.podcast_backend.dto;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything the mix engine needs: placed segments, music beds and where the music files live.
 */
public record MixPlan(List<Placement> placements, List<MusicOverlay> overlays, Map<UUID, Path> musicFiles) {
    public MixPlan {
        placements = List.copyOf(placements);
        overlays = List.copyOf(overlays);
        musicFiles = Map.copyOf(musicFiles);
    }

    public long totalDurationMs() {
        return placements.stream().mapToLong(Placement::endMs).max().orElse(0L);
    }
}
