package com.priceintel.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Per-user request counters. Stored in the scrape_budget table.
 * Daily counter belongs to {@code dailyDate}, monthly counter to the month
 * starting at {@code monthPeriodStart}; stale periods are reset on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeBudget {

    private String userId;
    private int dailyUsed;
    private LocalDate dailyDate;
    private int monthlyUsed;
    private LocalDate monthPeriodStart;
}
