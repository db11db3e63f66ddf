package com.example.podcast_backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Lookup table with per-plan episode length limits.
 */
@Entity
@Table(name = "plan_limits")
public class PlanLimits {
    @Id
    @Column(name = "plan", length = 32)
    private String plan;

    /** {@code null} means no length limit. */
    @Column(name = "max_minutes")
    private Integer maxMinutes;

    @Column(name = "allow_overlength", nullable = false)
    private boolean allowOverlength;

    @Column(name = "overlength_surcharge", nullable = false)
    private boolean overlengthSurcharge;

    protected PlanLimits() {
    }

    public PlanLimits(String plan, Integer maxMinutes, boolean allowOverlength, boolean overlengthSurcharge) {
        this.plan = plan;
        this.maxMinutes = maxMinutes;
        this.allowOverlength = allowOverlength;
        this.overlengthSurcharge = overlengthSurcharge;
    }

    public String getPlan() {
        return plan;
    }

    public Integer getMaxMinutes() {
        return maxMinutes;
    }

    public boolean isAllowOverlength() {
        return allowOverlength;
    }

    public boolean isOverlengthSurcharge() {
        return overlengthSurcharge;
    }
}
