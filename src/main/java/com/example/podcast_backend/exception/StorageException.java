package com.example.podcast_backend.exception;

/**
 * Raised by storage backends when an object cannot be read, written or addressed.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
