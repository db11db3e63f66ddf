package com.example.podcast_backend.model;

/**
 * Subscription tiers. Limits per tier live in {@link PlanLimits}.
 */
public enum PlanTier {
    STARTER,
    CREATOR,
    PRO,
    EXECUTIVE,
    ENTERPRISE,
    UNLIMITED
}
