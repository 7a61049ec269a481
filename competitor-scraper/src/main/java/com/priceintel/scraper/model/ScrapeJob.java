package com.priceintel.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Queue row in scrape_job. Delays between batches are expressed through
 * {@code scheduledFor}, never through in-process sleeps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeJob {

    private String id;
    private String userId;
    private String storeId;
    private String competitorId;
    private String targetUrl;       // competitor storefront for matching jobs
    private JobType jobType;
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;
    @Builder.Default
    private int batchNumber = 1;
    @Builder.Default
    private int totalBatches = 1;
    private int itemsProcessed;
    private int itemsTotal;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;    // null on success

    public enum JobType {
        TRACKING("tracking"),
        QUICK_START_MATCHING("quick_start_matching"),
        MATCHING("matching");

        private final String value;

        JobType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static JobType fromValue(String value) {
            for (JobType t : values()) {
                if (t.value.equals(value)) return t;
            }
            throw new IllegalArgumentException("Unknown job type: " + value);
        }
    }

    public enum JobStatus {
        PENDING("pending"),
        IN_PROGRESS("in_progress"),
        COMPLETED("completed"),
        FAILED("failed"),
        DEFERRED("deferred");

        private final String value;

        JobStatus(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == DEFERRED;
        }

        public static JobStatus fromValue(String value) {
            for (JobStatus s : values()) {
                if (s.value.equals(value)) return s;
            }
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
