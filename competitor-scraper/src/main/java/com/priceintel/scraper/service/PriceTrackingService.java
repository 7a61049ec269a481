package com.priceintel.scraper.service;

import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.ExtractedPrice;
import com.priceintel.scraper.model.PlanLimits;
import com.priceintel.scraper.model.PlanTier;
import com.priceintel.scraper.model.PriceHistoryEntry;
import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.model.ScrapeResult;
import com.priceintel.scraper.model.TrackingEligibility;
import com.priceintel.scraper.model.TrackingJobResult;
import com.priceintel.scraper.model.TrackingResult;
import com.priceintel.scraper.output.PriceHistoryRouter;
import com.priceintel.scraper.store.JobStore;
import com.priceintel.scraper.store.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs tracking passes: picks due links, fetches each through the budget,
 * extracts the price and moves the link's state forward.
 *
 * Fetch and extraction failures are absorbed into link state; the caller only
 * sees aggregate counts. A pass stops at the first budget deferral.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PriceTrackingService {

    static final int PAGE_SIZE = 50;
    static final String NO_PRICE_FOUND = "No price found on page";

    private final LinkStore linkStore;
    private final JobStore jobStore;
    private final BudgetedScrapeService scrapeService;
    private final PriceExtractor priceExtractor;
    private final SmartSkipPolicy smartSkipPolicy;
    private final RetryBackoffPolicy retryBackoffPolicy;
    private final PriceHistoryRouter priceHistoryRouter;
    private final PlanEntitlements planEntitlements;
    private final Clock clock;

    // ── Tracking pass ────────────────────────────────────────────────────────

    public TrackingJobResult runTrackingJob(String userId, String storeId, PlanTier tier) {
        TrackingJobResult result = new TrackingJobResult(userId, storeId);

        PlanLimits limits = planEntitlements.limitsFor(tier);
        if (!limits.trackingEnabled()) {
            log.info("Tracking disabled for plan {} (user {}), skipping store {}", tier, userId, storeId);
            return result;
        }

        Instant passStartedAt = clock.instant();
        Set<String> visited = new HashSet<>();
        log.info("Tracking pass started for user {} store {}", userId, storeId);

        pass:
        while (true) {
            // Rows whose state could not be saved stay due, so over-fetch past them.
            int limit = PAGE_SIZE + visited.size();
            List<CompetitorProductLink> page = linkStore.findDue(userId, storeId, clock.instant(), passStartedAt, limit);
            List<CompetitorProductLink> due = page.stream()
                    .filter(l -> visited.add(l.getId()))
                    .toList();
            if (due.isEmpty() && page.size() < limit) break;

            for (int i = 0; i < due.size(); i++) {
                CompetitorProductLink link = due.get(i);
                ScrapeResult fetch = scrapeService.scrape(userId, link.getUrl());

                if (fetch.configurationError()) {
                    result.setConfigurationError(true);
                    log.error("Tracking pass aborted for user {} store {}: {}", userId, storeId, fetch.error());
                    break pass;
                }
                if (fetch.deferred()) {
                    result.setBudgetExhausted(true);
                    for (CompetitorProductLink rest : due.subList(i, due.size())) {
                        result.add(TrackingResult.deferred(rest, fetch.error()));
                    }
                    log.warn("Budget exhausted for user {}, {} links deferred", userId, due.size() - i);
                    break pass;
                }

                result.add(fetch.success() ? applyPage(link, fetch.body()) : recordFailure(link, fetch.error()));
            }
        }

        log.info("Tracking pass finished for user {} store {}: processed={}, changes={}, errors={}, deferred={}",
                userId, storeId, result.getLinksProcessed(), result.getPriceChanges(),
                result.getErrors(), result.getLinksDeferred());
        return result;
    }

    public int countTrackableLinks(String userId, String storeId) {
        return linkStore.countTrackable(userId, storeId);
    }

    // ── Job bookkeeping ──────────────────────────────────────────────────────

    /**
     * Refused when the plan has no tracking, or when the last completed pass for
     * this store is more recent than the plan's sync interval.
     */
    public TrackingEligibility canRunTracking(String userId, String storeId, PlanTier tier) {
        PlanLimits limits = planEntitlements.limitsFor(tier);
        if (!limits.trackingEnabled()) {
            return TrackingEligibility.refused(null, "Tracking is not included in plan " + tier);
        }
        Optional<Instant> last = jobStore.findLastCompletedAt(userId, storeId, ScrapeJob.JobType.TRACKING);
        if (last.isPresent()) {
            Instant next = last.get().plus(Duration.ofHours(planEntitlements.hoursBetweenSync(tier)));
            if (clock.instant().isBefore(next)) {
                return TrackingEligibility.refused(next, "Next tracking run allowed at " + next);
            }
        }
        return TrackingEligibility.allow();
    }

    public ScrapeJob createTrackingJob(String userId, String storeId) {
        int total = countTrackableLinks(userId, storeId);
        ScrapeJob job = ScrapeJob.builder()
                .userId(userId)
                .storeId(storeId)
                .jobType(ScrapeJob.JobType.TRACKING)
                .itemsTotal(total)
                .scheduledFor(clock.instant())
                .build();
        job.setId(jobStore.insert(job));
        return job;
    }

    /**
     * Moves a job along pending, in_progress, then a terminal status.
     * Returns false when the row was not in the expected prior state.
     */
    public boolean updateJobStatus(String jobId, ScrapeJob.JobStatus status, int itemsProcessed, String errorMessage) {
        Instant now = clock.instant();
        return switch (status) {
            case PENDING -> throw new IllegalArgumentException("A job cannot be moved back to pending");
            case IN_PROGRESS -> jobStore.claim(jobId, now);
            default -> jobStore.finish(jobId, status, itemsProcessed, errorMessage, now);
        };
    }

    /**
     * Eligibility check, job row, pass, terminal status. Returns empty when the
     * store is not allowed to run yet.
     */
    public Optional<TrackingJobResult> runForStore(String userId, String storeId) {
        PlanTier tier = planEntitlements.tierForUser(userId);
        TrackingEligibility eligibility = canRunTracking(userId, storeId, tier);
        if (!eligibility.allowed()) {
            log.debug("Tracking skipped for user {} store {}: {}", userId, storeId, eligibility.reason());
            return Optional.empty();
        }
        ScrapeJob job = createTrackingJob(userId, storeId);
        if (!updateJobStatus(job.getId(), ScrapeJob.JobStatus.IN_PROGRESS, 0, null)) {
            log.warn("Tracking job {} was claimed elsewhere", job.getId());
            return Optional.empty();
        }
        return Optional.of(executeClaimed(job, tier));
    }

    /** Runs a tracking job that was queued externally and already claimed by the dispatcher. */
    public TrackingJobResult runQueuedJob(ScrapeJob job) {
        return executeClaimed(job, planEntitlements.tierForUser(job.getUserId()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private TrackingJobResult executeClaimed(ScrapeJob job, PlanTier tier) {
        TrackingJobResult result;
        try {
            result = runTrackingJob(job.getUserId(), job.getStoreId(), tier);
        } catch (RuntimeException e) {
            log.error("Tracking job {} failed: {}", job.getId(), e.getMessage(), e);
            updateJobStatus(job.getId(), ScrapeJob.JobStatus.FAILED, 0, e.getMessage());
            throw e;
        }

        int processed = result.getLinksProcessed() + result.getErrors();
        if (result.isConfigurationError()) {
            updateJobStatus(job.getId(), ScrapeJob.JobStatus.FAILED, processed, "Scraping provider not configured");
        } else if (result.isBudgetExhausted()) {
            updateJobStatus(job.getId(), ScrapeJob.JobStatus.DEFERRED, processed, "Budget exhausted");
        } else {
            updateJobStatus(job.getId(), ScrapeJob.JobStatus.COMPLETED, processed, null);
        }
        return result;
    }

    private TrackingResult applyPage(CompetitorProductLink link, String html) {
        ExtractedPrice extracted = priceExtractor.extract(html);
        if (!extracted.hasPrice()) {
            log.warn("No price found on page for link {} ({})", link.getId(), link.getUrl());
            return recordFailure(link, NO_PRICE_FOUND);
        }

        Instant now = clock.instant();
        BigDecimal oldPrice = link.getLastPrice();
        BigDecimal newPrice = extracted.price();
        boolean changed = oldPrice == null || oldPrice.compareTo(newPrice) != 0;

        link.setLastCurrency(extracted.currency());
        link.setLastAvailability(extracted.available());
        link.setLastCheckedAt(now);
        link.setErrorStreak(0);
        link.setNeedsAttention(false);

        if (changed) {
            link.setLastPrice(newPrice);
            link.setLastChangedAt(now);
            link.setNoChangeStreak(0);
            link.setNextAllowedCheckAt(null);
        } else {
            int streak = link.getNoChangeStreak() + 1;
            link.setNoChangeStreak(streak);
            link.setNextAllowedCheckAt(smartSkipPolicy.nextAllowedCheck(streak, now));
        }

        save(link);
        if (changed) {
            appendHistory(link, now);
            log.debug("Price change on link {}: {} -> {}", link.getId(), oldPrice, newPrice);
        }
        return new TrackingResult(link.getId(), link.getUrl(), true, changed, oldPrice, newPrice, false, null);
    }

    private TrackingResult recordFailure(CompetitorProductLink link, String error) {
        if (!NO_PRICE_FOUND.equals(error)) {
            log.warn("Fetch failed for link {} ({}): {}", link.getId(), link.getUrl(), error);
        }
        Instant now = clock.instant();
        int streak = link.getErrorStreak() + 1;

        link.setErrorStreak(streak);
        link.setLastCheckedAt(now);
        link.setLastErrorAt(now);
        link.setLastErrorMessage(error);
        link.setNextAllowedCheckAt(retryBackoffPolicy.nextRetryTime(streak, now));
        if (retryBackoffPolicy.isExhausted(streak)) {
            link.setNeedsAttention(true);
        }

        save(link);
        return TrackingResult.failed(link, error);
    }

    private void save(CompetitorProductLink link) {
        try {
            linkStore.saveTrackingState(link);
        } catch (DataAccessException e) {
            log.warn("Could not persist tracking state for link {}: {}", link.getId(), e.getMessage());
        }
    }

    private void appendHistory(CompetitorProductLink link, Instant now) {
        try {
            priceHistoryRouter.record(PriceHistoryEntry.builder()
                    .linkId(link.getId())
                    .price(link.getLastPrice())
                    .currency(link.getLastCurrency())
                    .availability(Boolean.TRUE.equals(link.getLastAvailability()))
                    .recordedAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not record price history for link {}: {}", link.getId(), e.getMessage());
        }
    }
}
