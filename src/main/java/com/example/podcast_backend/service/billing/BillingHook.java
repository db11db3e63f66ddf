package com.example.podcast_backend.service.billing;

import com.example.podcast_backend.config.BillingProperties;
import com.example.podcast_backend.model.BillingEvent;
import com.example.podcast_backend.model.PlanLimits;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.repository.BillingEventRepository;
import com.example.podcast_backend.service.Interfaces.CreditLedgerClient;
import com.example.podcast_backend.util.BillingStatus;
import com.example.podcast_backend.util.ChargeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Metered charges issued when an episode is finalized.
 *
 * <p>Each (job, charge kind) pair owns exactly one {@link BillingEvent} row, keyed by
 * {@link ChargeKind#correlationId(UUID)}. The row is claimed before the ledger is called and the
 * same id is sent to the ledger, so re-running a job can neither add a row nor charge twice.
 * Nothing in here throws: a failure is logged as {@code BILLING_INTEGRITY_GAP} and the job
 * carries on.
 */
@Service
public class BillingHook {
    private static final Logger LOGGER = LoggerFactory.getLogger(BillingHook.class);

    private final BillingEventRepository events;
    private final CreditLedgerClient ledger;
    private final PlanConfigService plans;
    private final BillingProperties properties;

    public BillingHook(BillingEventRepository events, CreditLedgerClient ledger, PlanConfigService plans,
                       BillingProperties properties) {
        this.events = events;
        this.ledger = ledger;
        this.plans = plans;
        this.properties = properties;
    }

    public void onAssemblyFinalized(UUID jobId, UUID ownerId, PlanTier planTier, long durationMs) {
        if (!properties.isEnabled()) {
            LOGGER.info("BILLING disabled jobId={}", jobId);
            return;
        }
        try {
            long seconds = ceilDiv(Math.max(0, durationMs), 1000);
            charge(jobId, ownerId, ChargeKind.ASSEMBLY, (int) ceilDiv(seconds, 60),
                    seconds * properties.getAssemblyCreditsPerSecond());

            long overSeconds = overlengthSeconds(planTier, seconds);
            if (overSeconds > 0) {
                charge(jobId, ownerId, ChargeKind.OVERLENGTH_SURCHARGE, (int) ceilDiv(overSeconds, 60),
                        overSeconds * properties.getOverlengthCreditsPerSecond());
            }
        } catch (RuntimeException e) {
            LOGGER.error("BILLING_INTEGRITY_GAP jobId={} stage=finalize cause={}", jobId, e.toString(), e);
        }
    }

    /**
     * Seconds beyond the plan limit that are billed as surcharge; 0 when the plan has no limit
     * or no surcharge.
     */
    long overlengthSeconds(PlanTier planTier, long seconds) {
        PlanLimits limits = plans.getLimits(planTier);
        if (limits.getMaxMinutes() == null) {
            return 0;
        }
        long over = seconds - limits.getMaxMinutes() * 60L;
        if (over <= 0) {
            return 0;
        }
        if (!limits.isAllowOverlength()) {
            LOGGER.warn("BILLING overlength on plan without overlength plan={} overSeconds={}", limits.getPlan(), over);
            return 0;
        }
        return limits.isOverlengthSurcharge() ? over : 0;
    }

    /**
     * Books one charge. Returns the resulting row status; never throws.
     */
    public BillingStatus charge(UUID jobId, UUID ownerId, ChargeKind kind, int minutes, long credits) {
        String correlationId = kind.correlationId(jobId);
        try {
            BillingEvent event = claim(jobId, ownerId, kind, minutes, credits);
            if (event.getStatus().isSettled()) {
                LOGGER.info("BILLING skip correlationId={} status={}", correlationId, event.getStatus());
                return event.getStatus();
            }
            event.incrementLedgerAttempts();
            BillingStatus status = switch (ledger.charge(ownerId, event.getCredits(), correlationId)) {
                case SUCCESS -> BillingStatus.CHARGED;
                case ALREADY_CHARGED -> BillingStatus.ALREADY_CHARGED;
                case FAILED -> BillingStatus.FAILED;
            };
            event.setStatus(status);
            events.save(event);
            if (status == BillingStatus.FAILED) {
                LOGGER.error("BILLING_INTEGRITY_GAP jobId={} correlationId={} credits={} reason=ledger_failed ledgerAttempts={}",
                        jobId, correlationId, event.getCredits(), event.getLedgerAttempts());
            } else {
                LOGGER.info("BILLING {} jobId={} correlationId={} minutes={} credits={}",
                        status, jobId, correlationId, event.getMinutes(), event.getCredits());
            }
            return status;
        } catch (RuntimeException e) {
            LOGGER.error("BILLING_INTEGRITY_GAP jobId={} correlationId={} credits={} cause={}",
                    jobId, correlationId, credits, e.toString());
            return BillingStatus.FAILED;
        }
    }

    private BillingEvent claim(UUID jobId, UUID ownerId, ChargeKind kind, int minutes, long credits) {
        String correlationId = kind.correlationId(jobId);
        var existing = events.findByCorrelationId(correlationId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return events.saveAndFlush(new BillingEvent(jobId, ownerId, kind, minutes, credits));
        } catch (DataIntegrityViolationException race) {
            // a concurrent run claimed it between the read and the insert
            return events.findByCorrelationId(correlationId).orElseThrow(() -> race);
        }
    }

    private static long ceilDiv(long a, long b) {
        return (a + b - 1) / b;
    }
}
