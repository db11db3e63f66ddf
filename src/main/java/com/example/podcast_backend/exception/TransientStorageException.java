package com.example.podcast_backend.exception;

/**
 * Storage failure that is worth retrying (timeouts, throttling, 5xx from the backend).
 */
public class TransientStorageException extends StorageException {
    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
