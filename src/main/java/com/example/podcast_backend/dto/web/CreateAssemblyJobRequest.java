package com.example.podcast_backend.dto.web;

import com.example.podcast_backend.util.ExecutionTarget;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.UUID;

public record CreateAssemblyJobRequest(
        @NotNull UUID ownerId,
        @NotBlank String episodeId,
        @NotNull UUID mainContentId,
        UUID templateId,
        UUID coverMediaId,
        @Valid List<Cut> cuts,
        Boolean markerCuts,
        ExecutionTarget target
) {
    public record Cut(@NotNull @PositiveOrZero Long startMs, @NotNull @PositiveOrZero Long endMs) {
    }
}
