package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.ListingScrapeResult;
import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.model.MatchingJobResult;
import com.priceintel.scraper.model.QuotaConsumption;
import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Processes one claimed {@code matching} job. Admissibility is re-checked at run
 * time since a batch queued yesterday may not be affordable today.
 *
 * A deferred batch is closed as {@code deferred} and a fresh pending copy is
 * queued for the start of the next UTC day. A batch refused by the monthly
 * discovery quota is closed as {@code failed} without a requeue.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchMatchingService {

    private final MatchingRateLimiter rateLimiter;
    private final BudgetLedger budgetLedger;
    private final DiscoveryQuotaService discoveryQuota;
    private final CompetitorListingScraper listingScraper;
    private final MatchingPipeline pipeline;
    private final JobStore jobStore;
    private final ScraperProperties properties;
    private final Clock clock;

    public MatchingJobResult processJob(ScrapeJob job) {
        MatchingJobResult.MatchingJobResultBuilder result = MatchingJobResult.builder()
                .userId(job.getUserId())
                .storeId(job.getStoreId())
                .competitorId(job.getCompetitorId())
                .batchNumber(job.getBatchNumber())
                .totalBatches(job.getTotalBatches());

        try {
            if (!rateLimiter.canRunHeavyMatching(job.getUserId())) {
                defer(job, "Heavy matching limit reached for today");
                return result.refusal("Heavy matching limit reached for today").build();
            }
            if (!budgetLedger.canScrape(job.getUserId(), 1)) {
                defer(job, "Budget exhausted");
                return result.budgetExhausted(true).refusal("Budget exhausted").build();
            }

            if (discoveryQuota.getOrCreate(job.getStoreId()).remaining() < 1) {
                finish(job, ScrapeJob.JobStatus.FAILED, 0, QuickStartMatchingService.DISCOVERY_QUOTA_EXHAUSTED);
                return result.refusal(QuickStartMatchingService.DISCOVERY_QUOTA_EXHAUSTED).build();
            }

            List<LocalProduct> slice = pipeline.unmatchedSlice(job.getStoreId(), job.getCompetitorId(),
                    properties.getMatching().getBatchSize(), offsetOf(job));
            if (slice.isEmpty()) {
                log.info("Batch {}/{} for competitor {} has nothing left to match",
                        job.getBatchNumber(), job.getTotalBatches(), job.getCompetitorId());
                finish(job, ScrapeJob.JobStatus.COMPLETED, 0, null);
                return result.build();
            }

            ListingScrapeResult listing = listingScraper.scrapeListing(job.getUserId(), job.getTargetUrl());
            if (listing.configurationError()) {
                finish(job, ScrapeJob.JobStatus.FAILED, 0, listing.error());
                return result.refusal(listing.error()).build();
            }
            if (listing.deferred() && listing.isEmpty()) {
                defer(job, "Budget exhausted");
                return result.budgetExhausted(true).productsDeferred(slice.size()).build();
            }

            QuotaConsumption quota = discoveryQuota.consume(job.getStoreId(), listing.candidates().size());
            if (!quota.allowed()) {
                log.warn("Batch {}/{} for competitor {} refused, {} candidates exceed remaining discovery quota {}",
                        job.getBatchNumber(), job.getTotalBatches(), job.getCompetitorId(),
                        listing.candidates().size(), quota.remaining());
                finish(job, ScrapeJob.JobStatus.FAILED, 0, QuickStartMatchingService.DISCOVERY_QUOTA_EXHAUSTED);
                return result.refusal(QuickStartMatchingService.DISCOVERY_QUOTA_EXHAUSTED).build();
            }

            int matched = pipeline.linkMatches(job.getUserId(), job.getStoreId(), job.getCompetitorId(),
                    slice, listing.candidates());
            rateLimiter.recordHeavyMatching(job.getUserId());
            finish(job, ScrapeJob.JobStatus.COMPLETED, slice.size(), null);

            log.info("Batch {}/{} for competitor {}: {} of {} products matched",
                    job.getBatchNumber(), job.getTotalBatches(), job.getCompetitorId(), matched, slice.size());
            return result.productsMatched(matched).build();

        } catch (RuntimeException e) {
            log.error("Matching job {} failed: {}", job.getId(), e.getMessage(), e);
            finish(job, ScrapeJob.JobStatus.FAILED, 0, e.getMessage());
            throw e;
        }
    }

    /** Offset of a batch in the catalog ordering; batch 1 is the quick-start head. */
    int offsetOf(ScrapeJob job) {
        ScraperProperties.Matching cfg = properties.getMatching();
        return cfg.getQuickStartCount() + Math.max(0, job.getBatchNumber() - 2) * cfg.getBatchSize();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void defer(ScrapeJob job, String reason) {
        Instant nextDay = LocalDate.now(clock).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        finish(job, ScrapeJob.JobStatus.DEFERRED, 0, reason);

        ScrapeJob retry = job.toBuilder()
                .id(null)
                .status(ScrapeJob.JobStatus.PENDING)
                .itemsProcessed(0)
                .scheduledFor(nextDay)
                .startedAt(null)
                .completedAt(null)
                .errorMessage(null)
                .build();
        jobStore.insert(retry);
        log.warn("Batch {}/{} for competitor {} deferred ({}), requeued for {}",
                job.getBatchNumber(), job.getTotalBatches(), job.getCompetitorId(), reason, nextDay);
    }

    private void finish(ScrapeJob job, ScrapeJob.JobStatus status, int itemsProcessed, String error) {
        if (!jobStore.finish(job.getId(), status, itemsProcessed, error, clock.instant())) {
            log.warn("Job {} was not in progress, status {} not recorded", job.getId(), status);
        }
    }
}
