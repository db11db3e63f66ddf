package com.example.podcast_backend.dto.web;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Body of an assembly task, identical for the remote worker and the managed queue.
 */
public record TaskPayload(@NotNull UUID jobId) {
}
