package com.example.podcast_backend.util;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    ERROR;

    /** Statuses whose jobs may still need their inputs (a retry re-reads them from ERROR). */
    public static Set<JobStatus> holdingInputs() {
        return EnumSet.of(PENDING, PROCESSING, ERROR);
    }

    public boolean isTerminal() {
        return this == PROCESSED || this == ERROR;
    }
}
