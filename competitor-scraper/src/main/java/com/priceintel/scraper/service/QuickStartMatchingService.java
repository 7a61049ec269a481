package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.ListingScrapeResult;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchingJobResult;
import com.priceintel.scraper.model.PlanLimits;
import com.priceintel.scraper.model.QuotaConsumption;
import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.store.JobStore;
import com.priceintel.scraper.store.ProductCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immediate matching of the head of the catalog when a competitor is added,
 * followed by queueing the rest as spaced-out batch jobs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuickStartMatchingService {

    static final String DISCOVERY_QUOTA_EXHAUSTED = "Monthly discovery quota exhausted";

    private final MatchingRateLimiter rateLimiter;
    private final BudgetLedger budgetLedger;
    private final DiscoveryQuotaService discoveryQuota;
    private final CompetitorListingScraper listingScraper;
    private final MatchingPipeline pipeline;
    private final ProductCatalog productCatalog;
    private final JobStore jobStore;
    private final PlanEntitlements planEntitlements;
    private final ScraperProperties properties;
    private final Clock clock;

    public MatchingJobResult startMatching(String userId, String storeId, String competitorId, String storefrontUrl) {
        requireText(userId, "userId");
        requireText(storeId, "storeId");
        requireText(competitorId, "competitorId");
        requireText(storefrontUrl, "storefrontUrl");

        MatchingJobResult.MatchingJobResultBuilder result = MatchingJobResult.builder()
                .userId(userId)
                .storeId(storeId)
                .competitorId(competitorId)
                .quickStart(true)
                .batchNumber(1)
                .totalBatches(1);

        if (!rateLimiter.canAddCompetitorStore(userId)) {
            log.warn("User {} reached the daily limit of new competitor stores", userId);
            return result.refusal("Daily limit of new competitor stores reached").build();
        }
        if (!budgetLedger.canScrape(userId, 1)) {
            log.warn("Quick-start for competitor {} refused, budget exhausted for user {}", competitorId, userId);
            return result.budgetExhausted(true).refusal("Scrape budget exhausted").build();
        }
        if (discoveryQuota.getOrCreate(storeId).remaining() < 1) {
            log.warn("Quick-start for competitor {} refused, discovery quota exhausted for store {}", competitorId, storeId);
            return result.refusal(DISCOVERY_QUOTA_EXHAUSTED).build();
        }

        ScraperProperties.Matching cfg = properties.getMatching();
        List<LocalProduct> head = pipeline.unmatchedSlice(storeId, competitorId, cfg.getQuickStartCount(), 0);

        ListingScrapeResult listing = listingScraper.scrapeListing(userId, storefrontUrl);
        if (listing.configurationError()) {
            return result.refusal(listing.error()).build();
        }
        if (listing.isEmpty()) {
            log.warn("No candidate products found on {}", storefrontUrl);
            return result.budgetExhausted(listing.deferred())
                    .productsDeferred(listing.deferred() ? head.size() : 0)
                    .build();
        }

        QuotaConsumption quota = discoveryQuota.consume(storeId, listing.candidates().size());
        if (!quota.allowed()) {
            log.warn("{} candidates from {} exceed the remaining discovery quota ({}) of store {}",
                    listing.candidates().size(), storefrontUrl, quota.remaining(), storeId);
            return result.refusal(DISCOVERY_QUOTA_EXHAUSTED).build();
        }

        int matched = pipeline.linkMatches(userId, storeId, competitorId, head, listing.candidates());
        rateLimiter.recordCompetitorStoreAdded(userId);

        List<ScrapeJob> batches = planBatches(userId, storeId, competitorId, storefrontUrl);
        jobStore.insertAll(batches);

        log.info("Quick-start for competitor {}: {} matched from {} products, {} batches queued",
                competitorId, matched, head.size(), batches.size());
        return result.productsMatched(matched)
                .batchesQueued(batches.size())
                .totalBatches(batches.size() + 1)
                .budgetExhausted(listing.deferred())
                .build();
    }

    /** Runs a queued quick-start job that the dispatcher already claimed. */
    public MatchingJobResult processJob(ScrapeJob job) {
        try {
            MatchingJobResult result = startMatching(job.getUserId(), job.getStoreId(),
                    job.getCompetitorId(), job.getTargetUrl());
            Instant now = clock.instant();
            if (result.isRefused()) {
                ScrapeJob.JobStatus status = result.isBudgetExhausted()
                        ? ScrapeJob.JobStatus.DEFERRED
                        : ScrapeJob.JobStatus.FAILED;
                jobStore.finish(job.getId(), status, 0, result.getRefusal(), now);
            } else {
                jobStore.finish(job.getId(), ScrapeJob.JobStatus.COMPLETED, result.getProductsMatched(), null, now);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Quick-start job {} failed: {}", job.getId(), e.getMessage(), e);
            jobStore.finish(job.getId(), ScrapeJob.JobStatus.FAILED, 0, e.getMessage(), clock.instant());
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * One job per batch beyond the quick-start head, limited to the plan's product
     * allowance. Batch n (n >= 2) is scheduled (n - 1) * batchDelay from now.
     */
    List<ScrapeJob> planBatches(String userId, String storeId, String competitorId, String storefrontUrl) {
        ScraperProperties.Matching cfg = properties.getMatching();
        PlanLimits limits = planEntitlements.limitsFor(planEntitlements.tierForUser(userId));

        int total = Math.min(productCatalog.countActiveProducts(storeId), limits.productsLimit());
        int remaining = total - cfg.getQuickStartCount();
        if (remaining <= 0 || cfg.getBatchSize() <= 0) return List.of();

        int tailBatches = (remaining + cfg.getBatchSize() - 1) / cfg.getBatchSize();
        int totalBatches = tailBatches + 1;
        Instant now = clock.instant();

        List<ScrapeJob> jobs = new ArrayList<>(tailBatches);
        for (int i = 0; i < tailBatches; i++) {
            jobs.add(ScrapeJob.builder()
                    .userId(userId)
                    .storeId(storeId)
                    .competitorId(competitorId)
                    .targetUrl(storefrontUrl)
                    .jobType(ScrapeJob.JobType.MATCHING)
                    .batchNumber(i + 2)
                    .totalBatches(totalBatches)
                    .itemsTotal(Math.min(cfg.getBatchSize(), remaining - i * cfg.getBatchSize()))
                    .scheduledFor(now.plus(cfg.getBatchDelay().multipliedBy(i + 1L)))
                    .build());
        }
        return jobs;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
