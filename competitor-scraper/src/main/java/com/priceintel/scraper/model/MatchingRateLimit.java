package com.priceintel.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Structural-operation counters for one user on one UTC day.
 * Tomorrow gets a fresh row, nothing is ever reset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchingRateLimit {

    private String userId;
    private LocalDate runDate;
    private int heavyMatchingCount;
    private int competitorStoresAdded;
    private int urlsAdded;

    public enum Counter {
        HEAVY_MATCHING("heavy_matching_count"),
        COMPETITOR_STORES_ADDED("competitor_stores_added"),
        URLS_ADDED("urls_added");

        private final String column;

        Counter(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }
    }
}
