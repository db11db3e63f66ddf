package com.example.podcast_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;

/**
 * Produced episode artifact. Only present once the owning job is PROCESSED.
 */
@Embeddable
public class AssemblyResult {
    @Column(name = "result_locator", length = 1024)
    private String finalLocator;

    @Column(name = "result_duration_ms")
    private Long durationMs;

    @Column(name = "result_cover_locator", length = 1024)
    private String coverLocator;

    @Column(name = "result_completed_at")
    private Instant completedAt;

    protected AssemblyResult() {
    }

    public AssemblyResult(String finalLocator, long durationMs, String coverLocator, Instant completedAt) {
        this.finalLocator = finalLocator;
        this.durationMs = durationMs;
        this.coverLocator = coverLocator;
        this.completedAt = completedAt;
    }

    public String getFinalLocator() {
        return finalLocator;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public String getCoverLocator() {
        return coverLocator;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    /** Same bytes, new address. */
    public AssemblyResult withFinalLocator(String newLocator) {
        return new AssemblyResult(newLocator, durationMs == null ? 0L : durationMs, coverLocator, completedAt);
    }
}
