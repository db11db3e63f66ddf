package com.example.podcast_backend.service.billing;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.podcast_backend.config.BillingProperties;
import com.example.podcast_backend.model.BillingEvent;
import com.example.podcast_backend.model.PlanLimits;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.repository.BillingEventRepository;
import com.example.podcast_backend.service.Interfaces.CreditLedgerClient;
import com.example.podcast_backend.util.BillingStatus;
import com.example.podcast_backend.util.ChargeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BillingHookTest {

    private static final long NINETY_MINUTES_MS = 90 * 60 * 1000L;

    @Mock
    private BillingEventRepository events;

    @Mock
    private CreditLedgerClient ledger;

    @Mock
    private PlanConfigService plans;

    // stand-in for the billing_event table, keyed like its unique index
    private final Map<String, BillingEvent> table = new LinkedHashMap<>();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger hookLogger = (Logger) LoggerFactory.getLogger(BillingHook.class);

    private BillingHook hook;
    private UUID jobId;
    private UUID ownerId;

    @BeforeEach
    void setUp() {
        appender.start();
        hookLogger.addAppender(appender);
        jobId = UUID.randomUUID();
        ownerId = UUID.randomUUID();
        hook = new BillingHook(events, ledger, plans, new BillingProperties());

        lenient().when(events.findByCorrelationId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(table.get(inv.<String>getArgument(0))));
        lenient().when(events.saveAndFlush(any(BillingEvent.class))).thenAnswer(inv -> {
            BillingEvent e = inv.getArgument(0);
            table.put(e.getCorrelationId(), e);
            return e;
        });
        lenient().when(events.save(any(BillingEvent.class))).thenAnswer(inv -> {
            BillingEvent e = inv.getArgument(0);
            table.put(e.getCorrelationId(), e);
            return e;
        });
    }

    @AfterEach
    void tearDown() {
        hookLogger.detachAppender(appender);
    }

    private boolean loggedIntegrityGap() {
        return appender.list.stream()
                .anyMatch(e -> e.getLevel() == Level.ERROR && e.getFormattedMessage().startsWith("BILLING_INTEGRITY_GAP"));
    }

    @Test
    void ninetyMinutesOnAnEightyMinutePlanBooksOneTenMinuteSurcharge() {
        when(plans.getLimits(PlanTier.CREATOR)).thenReturn(new PlanLimits("CREATOR", 80, true, true));
        when(ledger.charge(eq(ownerId), anyLong(), anyString())).thenReturn(CreditLedgerClient.Outcome.SUCCESS);

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.CREATOR, NINETY_MINUTES_MS);

        BillingEvent assembly = table.get(ChargeKind.ASSEMBLY.correlationId(jobId));
        BillingEvent surcharge = table.get(ChargeKind.OVERLENGTH_SURCHARGE.correlationId(jobId));
        assertThat(table).hasSize(2);
        assertThat(assembly.getCredits()).isEqualTo(5400L * 3);
        assertThat(assembly.getMinutes()).isEqualTo(90);
        assertThat(surcharge.getMinutes()).isEqualTo(10);
        assertThat(surcharge.getCredits()).isEqualTo(600L);
        assertThat(surcharge.getStatus()).isEqualTo(BillingStatus.CHARGED);
        verify(ledger).charge(ownerId, 600L, "overlength_surcharge:" + jobId);
    }

    @Test
    void rerunningTheSameJobChargesNothingNew() {
        when(plans.getLimits(PlanTier.CREATOR)).thenReturn(new PlanLimits("CREATOR", 80, true, true));
        when(ledger.charge(eq(ownerId), anyLong(), anyString())).thenReturn(CreditLedgerClient.Outcome.SUCCESS);

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.CREATOR, NINETY_MINUTES_MS);
        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.CREATOR, NINETY_MINUTES_MS);

        assertThat(table).hasSize(2);
        verify(ledger, times(2)).charge(eq(ownerId), anyLong(), anyString());
        verify(events, times(2)).saveAndFlush(any());
    }

    @Test
    void withinPlanLimitOnlyTheAssemblyChargeIsBooked() {
        when(plans.getLimits(PlanTier.PRO)).thenReturn(new PlanLimits("PRO", 120, true, true));
        when(ledger.charge(eq(ownerId), anyLong(), anyString())).thenReturn(CreditLedgerClient.Outcome.SUCCESS);

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.PRO, NINETY_MINUTES_MS);

        assertThat(table).containsOnlyKeys(ChargeKind.ASSEMBLY.correlationId(jobId));
    }

    @Test
    void planWithoutSurchargeIsNotChargedForOverlength() {
        when(plans.getLimits(PlanTier.EXECUTIVE)).thenReturn(new PlanLimits("EXECUTIVE", 60, true, false));
        when(ledger.charge(eq(ownerId), anyLong(), anyString())).thenReturn(CreditLedgerClient.Outcome.SUCCESS);

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.EXECUTIVE, NINETY_MINUTES_MS);

        assertThat(table).hasSize(1);
    }

    @Test
    void ledgerFailureIsLoggedAsIntegrityGapAndRetriedOnTheNextRun() {
        when(plans.getLimits(PlanTier.STARTER)).thenReturn(new PlanLimits("STARTER", 40, false, false));
        when(ledger.charge(eq(ownerId), anyLong(), anyString()))
                .thenReturn(CreditLedgerClient.Outcome.FAILED)
                .thenReturn(CreditLedgerClient.Outcome.ALREADY_CHARGED);

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.STARTER, 30_000);
        BillingEvent row = table.get(ChargeKind.ASSEMBLY.correlationId(jobId));
        assertThat(row.getStatus()).isEqualTo(BillingStatus.FAILED);
        assertThat(loggedIntegrityGap()).isTrue();

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.STARTER, 30_000);
        assertThat(table).hasSize(1);
        assertThat(row.getStatus()).isEqualTo(BillingStatus.ALREADY_CHARGED);
        assertThat(row.getLedgerAttempts()).isEqualTo(2);
    }

    @Test
    void ledgerExceptionNeverEscapes() {
        when(ledger.charge(any(), anyLong(), anyString())).thenThrow(new IllegalStateException("socket closed"));

        BillingStatus status = hook.charge(jobId, ownerId, ChargeKind.ASSEMBLY, 1, 90);

        assertThat(status).isEqualTo(BillingStatus.FAILED);
        assertThat(loggedIntegrityGap()).isTrue();
    }

    @Test
    void repositoryOutageDuringFinalizeIsSwallowedAndLogged() {
        when(events.findByCorrelationId(anyString())).thenThrow(new IllegalStateException("db down"));
        when(plans.getLimits(PlanTier.UNLIMITED)).thenReturn(new PlanLimits("UNLIMITED", null, true, false));

        hook.onAssemblyFinalized(jobId, ownerId, PlanTier.UNLIMITED, 60_000);

        assertThat(loggedIntegrityGap()).isTrue();
        verify(ledger, never()).charge(any(), anyLong(), anyString());
    }

    @Test
    void disabledBillingDoesNothing() {
        BillingProperties off = new BillingProperties();
        off.setEnabled(false);

        new BillingHook(events, ledger, plans, off).onAssemblyFinalized(jobId, ownerId, PlanTier.PRO, NINETY_MINUTES_MS);

        assertThat(table).isEmpty();
        verify(ledger, never()).charge(any(), anyLong(), anyString());
    }
}
