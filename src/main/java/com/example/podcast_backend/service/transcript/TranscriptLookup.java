package com.example.podcast_backend.service.transcript;

import com.example.podcast_backend.dto.WordTiming;

import java.util.List;
import java.util.UUID;

/**
 * Word timings plus where they came from. {@code mediaId} and {@code transcriptId} are null for
 * legacy hits that were found by filename only.
 */
public record TranscriptLookup(List<WordTiming> words, Source source, UUID mediaId, UUID transcriptId) {

    public enum Source {
        INLINE,
        ARCHIVE,
        LEGACY_ARCHIVE,
        LEGACY_LOCAL
    }
}
