package com.example.podcast_backend.engine.Interfaces;

import com.example.podcast_backend.dto.MixPlan;
import com.example.podcast_backend.dto.MixResult;

import java.nio.file.Path;

public interface AudioMixEngine {
    long probeDurationMs(Path file);

    /**
     * Mixes, loudness-normalises and encodes the plan into {@code output}.
     */
    MixResult mix(MixPlan plan, Path output);
}
