package com.example.podcast_backend.dto.web;

import java.time.Instant;
import java.util.UUID;

public record AssemblyJobResponse(
        UUID id,
        String episodeId,
        String status,
        int attempts,
        String failureKind,
        String failureReason,
        String finalLocator,
        Long durationMs,
        String coverLocator,
        String playbackUrl,
        Instant createdAt,
        Instant updatedAt
) {
}
