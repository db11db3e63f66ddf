package com.example.podcast_backend.util;

import java.util.Locale;
import java.util.UUID;

public enum ChargeKind {
    ASSEMBLY,
    OVERLENGTH_SURCHARGE;

    /** Deterministic ledger key for this charge on the given job, stable across retries. */
    public String correlationId(UUID jobId) {
        return name().toLowerCase(Locale.ROOT) + ":" + jobId;
    }
}
