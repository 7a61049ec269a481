package com.priceintel.scraper.store;

import com.priceintel.scraper.model.ScrapeBudget;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Persistence of per-user request counters. All mutations are single statements
 * so concurrent runners for the same user cannot lose increments.
 */
public interface BudgetStore {

    Optional<ScrapeBudget> find(String userId);

    void createIfAbsent(String userId, LocalDate today, LocalDate monthStart);

    /** Zeroes the daily counter unless it already belongs to {@code today}. */
    void resetDaily(String userId, LocalDate today);

    /** Zeroes the monthly counter if its period started before {@code monthStart}. */
    void resetMonthly(String userId, LocalDate monthStart);

    /** Adds {@code cost} to both counters and returns the updated row. */
    Optional<ScrapeBudget> increment(String userId, int cost);
}
