package com.example.podcast_backend.util;

public enum FailureKind {
    /** Input asset absent on every backend; retrying without fixing it is pointless. */
    INPUT_MISSING,
    /** Storage or database hiccup that outlived its retry budget. */
    TRANSIENT_INFRA,
    PROCESSING_FAILED,
    /** Result was produced but the PROCESSED status could not be persisted. */
    TERMINAL_COMMIT_FAILED
}
