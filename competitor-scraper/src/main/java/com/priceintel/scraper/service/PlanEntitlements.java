package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.PlanLimits;
import com.priceintel.scraper.model.PlanProfile;
import com.priceintel.scraper.model.PlanTier;
import com.priceintel.scraper.store.PlanDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps account plans to their scraping allowances. A free-demo account inside
 * its trial window is treated as PRO.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlanEntitlements {

    private final ScraperProperties properties;
    private final PlanDirectory planDirectory;
    private final Clock clock;

    public PlanTier effectivePlan(PlanProfile profile) {
        if (profile == null) return PlanTier.FREE_DEMO;
        PlanTier tier = PlanTier.from(profile.rawPlan());
        if (tier == PlanTier.FREE_DEMO && isTrialActive(profile)) {
            return PlanTier.PRO;
        }
        return tier;
    }

    public boolean isTrialActive(PlanProfile profile) {
        Instant trialEnd = profile.trialEndsAt();
        if (trialEnd == null && profile.createdAt() != null) {
            trialEnd = profile.createdAt().plus(Duration.ofDays(properties.getPlans().getTrialDays()));
        }
        return trialEnd != null && clock.instant().isBefore(trialEnd);
    }

    public PlanTier tierForUser(String userId) {
        return lookup(() -> planDirectory.findByUserId(userId), "user", userId);
    }

    public PlanTier tierForStore(String storeId) {
        return lookup(() -> planDirectory.findByStoreId(storeId), "store", storeId);
    }

    public PlanLimits limitsFor(PlanTier tier) {
        ScraperProperties.Plans plans = properties.getPlans();
        ScraperProperties.PlanLimitsConfig cfg = switch (tier) {
            case FREE_DEMO -> plans.getFreeDemo();
            case STARTER -> plans.getStarter();
            case PRO -> plans.getPro();
            case SCALE -> plans.getScale();
        };
        return new PlanLimits(tier,
                cfg.getTrackingRunsPerDay(),
                cfg.getProductsLimit(),
                cfg.getCompetitorsPerProduct(),
                cfg.getDiscoveryMonthlyLimit());
    }

    /** floor(24 / runs per day); Integer.MAX_VALUE when the plan has no tracking. */
    public int hoursBetweenSync(PlanTier tier) {
        int runs = limitsFor(tier).trackingRunsPerDay();
        return runs <= 0 ? Integer.MAX_VALUE : 24 / runs;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private PlanTier lookup(Supplier<Optional<PlanProfile>> query, String kind, String id) {
        try {
            return query.get().map(this::effectivePlan).orElse(PlanTier.FREE_DEMO);
        } catch (DataAccessException e) {
            log.warn("Plan lookup failed for {} {}, assuming free demo: {}", kind, id, e.getMessage());
            return PlanTier.FREE_DEMO;
        }
    }
}
