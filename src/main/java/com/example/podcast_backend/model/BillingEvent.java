package com.example.podcast_backend.model;

import com.example.podcast_backend.util.BillingStatus;
import com.example.podcast_backend.util.ChargeKind;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Idempotent ledger entry; the unique correlation id is the guard against double charging.
 */
@Entity
@Table(
        name = "billing_event",
        uniqueConstraints = @UniqueConstraint(name = "uq_billing_event_correlation", columnNames = "correlation_id"),
        indexes = @Index(name = "idx_billing_event_job", columnList = "job_id")
)
public class BillingEvent {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "correlation_id", nullable = false, updatable = false, length = 128)
    private String correlationId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_kind", nullable = false, length = 32, updatable = false)
    private ChargeKind chargeKind;

    @Column(name = "minutes", nullable = false)
    private int minutes;

    @Column(name = "credits", nullable = false)
    private long credits;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BillingStatus status = BillingStatus.PENDING;

    @Column(name = "ledger_attempts", nullable = false)
    private int ledgerAttempts;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected BillingEvent() {
    }

    public BillingEvent(UUID jobId, UUID ownerId, ChargeKind chargeKind, int minutes, long credits) {
        this.correlationId = chargeKind.correlationId(jobId);
        this.jobId = jobId;
        this.ownerId = ownerId;
        this.chargeKind = chargeKind;
        this.minutes = minutes;
        this.credits = credits;
    }

    public UUID getId() {
        return id;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public UUID getJobId() {
        return jobId;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public ChargeKind getChargeKind() {
        return chargeKind;
    }

    public int getMinutes() {
        return minutes;
    }

    public long getCredits() {
        return credits;
    }

    public BillingStatus getStatus() {
        return status;
    }

    public void setStatus(BillingStatus status) {
        this.status = status;
    }

    public int getLedgerAttempts() {
        return ledgerAttempts;
    }

    public void incrementLedgerAttempts() {
        this.ledgerAttempts++;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
