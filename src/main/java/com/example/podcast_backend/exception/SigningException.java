package com.example.podcast_backend.exception;

public class SigningException extends StorageException {
    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
