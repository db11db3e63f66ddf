package com.example.podcast_backend.exception;

/**
 * Non-transient failure inside the mix/encode stage (ffmpeg exit code, bad template, ...).
 */
public class AssemblyException extends RuntimeException {
    public AssemblyException(String message) {
        super(message);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
