package com.example.podcast_backend.dto;

import java.nio.file.Path;

public record MixResult(Path file, long durationMs) {
}
