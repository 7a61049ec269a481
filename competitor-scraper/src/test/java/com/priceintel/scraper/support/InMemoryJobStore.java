package com.priceintel.scraper.support;

import com.priceintel.scraper.model.ScrapeJob;
import com.priceintel.scraper.store.JobStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class InMemoryJobStore implements JobStore {

    private final Map<String, ScrapeJob> rows = new LinkedHashMap<>();
    private int sequence;

    @Override
    public String insert(ScrapeJob job) {
        String id = job.getId() != null ? job.getId() : "job-" + (++sequence);
        rows.put(id, job.toBuilder().id(id).build());
        return id;
    }

    @Override
    public void insertAll(List<ScrapeJob> jobs) {
        jobs.forEach(this::insert);
    }

    @Override
    public List<ScrapeJob> findDue(ScrapeJob.JobType type, Instant now, int limit) {
        return rows.values().stream()
                .filter(j -> j.getJobType() == type)
                .filter(j -> j.getStatus() == ScrapeJob.JobStatus.PENDING)
                .filter(j -> !j.getScheduledFor().isAfter(now))
                .sorted(Comparator.comparing(ScrapeJob::getScheduledFor)
                        .thenComparing(ScrapeJob::getBatchNumber)
                        .thenComparing(ScrapeJob::getId))
                .limit(limit)
                .map(j -> j.toBuilder().build())
                .toList();
    }

    @Override
    public boolean claim(String jobId, Instant now) {
        ScrapeJob job = rows.get(jobId);
        if (job == null || job.getStatus() != ScrapeJob.JobStatus.PENDING) return false;
        job.setStatus(ScrapeJob.JobStatus.IN_PROGRESS);
        job.setStartedAt(now);
        return true;
    }

    @Override
    public boolean finish(String jobId, ScrapeJob.JobStatus status, int itemsProcessed,
                          String errorMessage, Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        ScrapeJob job = rows.get(jobId);
        if (job == null || job.getStatus() != ScrapeJob.JobStatus.IN_PROGRESS) return false;
        job.setStatus(status);
        job.setItemsProcessed(itemsProcessed);
        job.setErrorMessage(errorMessage);
        job.setCompletedAt(now);
        return true;
    }

    @Override
    public Optional<Instant> findLastCompletedAt(String userId, String storeId, ScrapeJob.JobType type) {
        return rows.values().stream()
                .filter(j -> Objects.equals(userId, j.getUserId()) && Objects.equals(storeId, j.getStoreId()))
                .filter(j -> j.getJobType() == type && j.getStatus() == ScrapeJob.JobStatus.COMPLETED)
                .map(ScrapeJob::getCompletedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    public ScrapeJob get(String id) {
        ScrapeJob job = rows.get(id);
        return job == null ? null : job.toBuilder().build();
    }

    public List<ScrapeJob> all() {
        return rows.values().stream().map(j -> j.toBuilder().build()).toList();
    }

    public List<ScrapeJob> withStatus(ScrapeJob.JobStatus status) {
        return all().stream().filter(j -> j.getStatus() == status).toList();
    }
}
