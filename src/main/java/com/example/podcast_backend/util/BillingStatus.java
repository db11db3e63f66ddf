package com.example.podcast_backend.util;

public enum BillingStatus {
    PENDING,
    CHARGED,
    ALREADY_CHARGED,
    FAILED;

    public boolean isSettled() {
        return this == CHARGED || this == ALREADY_CHARGED;
    }
}
