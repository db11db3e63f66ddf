package com.example.podcast_backend.exception;

import java.util.UUID;

public class TranscriptConflictException extends RuntimeException {
    private final UUID mediaId;

    public TranscriptConflictException(UUID mediaId, UUID existingTranscriptId) {
        super("Media " + mediaId + " is already linked to transcript " + existingTranscriptId);
        this.mediaId = mediaId;
    }

    public TranscriptConflictException(UUID mediaId, Throwable cause) {
        super("Media " + mediaId + " was linked to a transcript concurrently", cause);
        this.mediaId = mediaId;
    }

    public UUID getMediaId() {
        return mediaId;
    }
}
