package com.example.podcast_backend.exception;

import java.util.UUID;

/**
 * An assembly input could not be resolved from any backend. Jobs failing with this are not
 * retried automatically; the input has to be fixed first.
 */
public class MissingInputException extends RuntimeException {
    private final UUID mediaId;

    public MissingInputException(UUID mediaId, String message) {
        super(message);
        this.mediaId = mediaId;
    }

    public MissingInputException(UUID mediaId, String message, Throwable cause) {
        super(message, cause);
        this.mediaId = mediaId;
    }

    public UUID getMediaId() {
        return mediaId;
    }
}
