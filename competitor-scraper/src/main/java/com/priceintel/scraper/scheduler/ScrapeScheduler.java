package com.priceintel.scraper.scheduler;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.model.TrackingTarget;
import com.priceintel.scraper.service.BatchMatchingService;
import com.priceintel.scraper.service.PriceTrackingService;
import com.priceintel.scraper.service.QuickStartMatchingService;
import com.priceintel.scraper.store.JobStore;
import com.priceintel.scraper.store.LinkStore;
import com.priceintel.scraper.store.SchemaManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Periodic entry points.
 *
 * Tracking: hourly by default. Each store is only actually tracked when its plan
 * cadence allows (hours between syncs), so the cron just needs to be finer than
 * the fastest plan.
 *
 * Job poll: picks up due queue rows and runs them one at a time, alternating
 * between job types so a long tail of batches cannot starve quick-starts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final SchemaManager schemaManager;
    private final LinkStore linkStore;
    private final JobStore jobStore;
    private final PriceTrackingService trackingService;
    private final QuickStartMatchingService quickStartService;
    private final BatchMatchingService batchService;
    private final ScraperProperties properties;
    private final Clock clock;

    @PostConstruct
    public void onStartup() {
        try {
            schemaManager.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise scraper schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running a tracking pass now");
            scheduledTracking();
        } else {
            log.info("Scraper ready. Tracking cron: {}", properties.getScheduling().getTrackingCron());
        }
    }

    @Scheduled(cron = "${price-scraper.scheduling.tracking-cron:0 0 * * * *}", zone = "UTC")
    public void scheduledTracking() {
        List<TrackingTarget> targets;
        try {
            targets = linkStore.findTrackingTargets();
        } catch (Exception e) {
            log.error("Could not load tracking targets: {}", e.getMessage(), e);
            return;
        }

        log.info("Scheduled tracking triggered for {} stores", targets.size());
        int ran = 0;
        for (TrackingTarget target : targets) {
            try {
                if (trackingService.runForStore(target.userId(), target.storeId()).isPresent()) {
                    ran++;
                }
            } catch (Exception e) {
                log.error("Tracking failed for user {} store {}: {}",
                        target.userId(), target.storeId(), e.getMessage(), e);
            }
        }
        log.info("Scheduled tracking done: {} of {} stores ran", ran, targets.size());
    }

    @Scheduled(fixedDelayString = "${price-scraper.scheduling.job-poll-interval:PT60S}", initialDelayString = "PT30S")
    public void pollJobs() {
        try {
            dispatchDueJobs();
        } catch (Exception e) {
            log.error("Job poll failed: {}", e.getMessage(), e);
        }
    }

    /** Claims and runs up to jobs-per-poll due jobs, round-robin across job types. */
    public int dispatchDueJobs() {
        int limit = properties.getScheduling().getJobsPerPoll();
        Instant now = clock.instant();

        List<ScrapeJob> order = interleave(List.of(
                jobStore.findDue(ScrapeJob.JobType.QUICK_START_MATCHING, now, limit),
                jobStore.findDue(ScrapeJob.JobType.MATCHING, now, limit),
                jobStore.findDue(ScrapeJob.JobType.TRACKING, now, limit)), limit);

        int dispatched = 0;
        for (ScrapeJob job : order) {
            if (!jobStore.claim(job.getId(), clock.instant())) {
                log.debug("Job {} already claimed", job.getId());
                continue;
            }
            try {
                switch (job.getJobType()) {
                    case QUICK_START_MATCHING -> quickStartService.processJob(job);
                    case MATCHING -> batchService.processJob(job);
                    case TRACKING -> trackingService.runQueuedJob(job);
                }
                dispatched++;
            } catch (Exception e) {
                log.error("Job {} ({}) failed: {}", job.getId(), job.getJobType().value(), e.getMessage(), e);
            }
        }
        if (dispatched > 0) {
            log.info("Dispatched {} queued jobs", dispatched);
        }
        return dispatched;
    }

    static List<ScrapeJob> interleave(List<List<ScrapeJob>> queues, int limit) {
        List<Iterator<ScrapeJob>> iterators = new ArrayList<>();
        queues.forEach(q -> iterators.add(q.iterator()));

        List<ScrapeJob> order = new ArrayList<>();
        boolean progressed = true;
        while (order.size() < limit && progressed) {
            progressed = false;
            for (Iterator<ScrapeJob> it : iterators) {
                if (order.size() >= limit) break;
                if (it.hasNext()) {
                    order.add(it.next());
                    progressed = true;
                }
            }
        }
        return order;
    }
}
