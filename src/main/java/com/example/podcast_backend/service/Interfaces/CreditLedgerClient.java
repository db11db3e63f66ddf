package com.example.podcast_backend.service.Interfaces;

import java.util.UUID;

/**
 * External credit ledger. Implementations must forward {@code correlationId} so the ledger can
 * dedupe repeated charges.
 */
public interface CreditLedgerClient {

    enum Outcome {
        SUCCESS,
        ALREADY_CHARGED,
        FAILED
    }

    Outcome charge(UUID userId, long amount, String correlationId);
}
