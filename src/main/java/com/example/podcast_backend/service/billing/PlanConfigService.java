package com.example.podcast_backend.service.billing;

import com.example.podcast_backend.model.PlanLimits;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.repository.PlanLimitsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves plan configuration from the {@code plan_limits} lookup table with built-in fallbacks.
 */
@Service
public class PlanConfigService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlanConfigService.class);
    private final PlanLimitsRepository planLimitsRepository;
    private final Map<PlanTier, PlanLimits> defaultLimits = new EnumMap<>(PlanTier.class);

    public PlanConfigService(PlanLimitsRepository planLimitsRepository) {
        this.planLimitsRepository = planLimitsRepository;
        defaultLimits.put(PlanTier.STARTER, new PlanLimits("STARTER", 40, false, false));
        defaultLimits.put(PlanTier.CREATOR, new PlanLimits("CREATOR", 80, true, true));
        defaultLimits.put(PlanTier.PRO, new PlanLimits("PRO", 120, true, true));
        defaultLimits.put(PlanTier.EXECUTIVE, new PlanLimits("EXECUTIVE", 240, true, false));
        defaultLimits.put(PlanTier.ENTERPRISE, new PlanLimits("ENTERPRISE", null, true, false));
        defaultLimits.put(PlanTier.UNLIMITED, new PlanLimits("UNLIMITED", null, true, false));
    }

    /**
     * Loads the configured limits for a tier, logging when a fallback is used.
     *
     * @param tier account tier, {@code null} is treated as STARTER
     * @return resolved limits (never {@code null}).
     */
    public PlanLimits getLimits(PlanTier tier) {
        PlanTier effective = tier == null ? PlanTier.STARTER : tier;
        return planLimitsRepository.findById(effective.name())
                .orElseGet(() -> {
                    LOGGER.info("PlanConfigService fallback plan={} reason=missing_lookup", effective);
                    return defaultLimits.get(effective);
                });
    }
}
