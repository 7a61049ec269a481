package com.priceintel.scraper.store;

import com.priceintel.scraper.model.ScrapeJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The scrape_job queue. Status changes are guarded: a job is claimed only from
 * pending and finished only from in_progress, so terminal rows never move again.
 */
public interface JobStore {

    /** @return the generated job id */
    String insert(ScrapeJob job);

    void insertAll(List<ScrapeJob> jobs);

    List<ScrapeJob> findDue(ScrapeJob.JobType type, Instant now, int limit);

    boolean claim(String jobId, Instant now);

    boolean finish(String jobId, ScrapeJob.JobStatus status, int itemsProcessed, String errorMessage, Instant now);

    Optional<Instant> findLastCompletedAt(String userId, String storeId, ScrapeJob.JobType type);
}
