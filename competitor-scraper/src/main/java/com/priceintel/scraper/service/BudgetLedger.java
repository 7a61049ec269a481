package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.BudgetStatus;
import com.priceintel.scraper.model.ScrapeBudget;
import com.priceintel.scraper.store.BudgetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Per-user daily and monthly request counters, the gate in front of every paid fetch.
 *
 * Limits are derived from the cost model in {@link ScraperProperties.Budget}. Stale
 * periods are rolled over on read. When the store cannot be reached the ledger
 * answers according to {@code price-scraper.budget.fail-open}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetLedger {

    private final BudgetStore budgetStore;
    private final ScraperProperties properties;
    private final Clock clock;

    public BudgetStatus getOrCreate(String userId) {
        requireUser(userId);
        LocalDate today = LocalDate.now(clock);
        LocalDate monthStart = today.withDayOfMonth(1);

        try {
            Optional<ScrapeBudget> existing = budgetStore.find(userId);
            if (existing.isEmpty()) {
                budgetStore.createIfAbsent(userId, today, monthStart);
                existing = budgetStore.find(userId);
            } else if (isStale(existing.get(), today, monthStart)) {
                ScrapeBudget stale = existing.get();
                if (!today.equals(stale.getDailyDate())) {
                    budgetStore.resetDaily(userId, today);
                }
                if (stale.getMonthPeriodStart() == null || stale.getMonthPeriodStart().isBefore(monthStart)) {
                    budgetStore.resetMonthly(userId, monthStart);
                }
                log.debug("Rolled over budget period for user {}", userId);
                existing = budgetStore.find(userId);
            }
            return existing.map(this::toStatus).orElseGet(this::unavailable);
        } catch (DataAccessException e) {
            log.warn("Budget lookup failed for user {} (failOpen={}): {}",
                    userId, properties.getBudget().isFailOpen(), e.getMessage());
            return unavailable();
        }
    }

    /** Charges {@code cost} to both counters. Call only after the provider served the page. */
    public BudgetStatus increment(String userId, int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0, was " + cost);
        }
        BudgetStatus current = getOrCreate(userId);
        if (!current.storeAvailable()) {
            return current;
        }
        try {
            return budgetStore.increment(userId, cost)
                    .map(this::toStatus)
                    .orElseGet(this::unavailable);
        } catch (DataAccessException e) {
            log.warn("Budget increment of {} failed for user {}: {}", cost, userId, e.getMessage());
            return unavailable();
        }
    }

    public boolean canScrape(String userId, int cost) {
        return getOrCreate(userId).admits(cost);
    }

    public int dailyLimit() {
        return properties.getBudget().dailyRequestLimit();
    }

    public int monthlyLimit() {
        return properties.getBudget().monthlyRequestLimit();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isStale(ScrapeBudget budget, LocalDate today, LocalDate monthStart) {
        return !today.equals(budget.getDailyDate())
                || budget.getMonthPeriodStart() == null
                || budget.getMonthPeriodStart().isBefore(monthStart);
    }

    private BudgetStatus toStatus(ScrapeBudget budget) {
        return BudgetStatus.of(budget.getDailyUsed(), dailyLimit(), budget.getMonthlyUsed(), monthlyLimit());
    }

    private BudgetStatus unavailable() {
        return BudgetStatus.unavailable(dailyLimit(), monthlyLimit(), properties.getBudget().isFailOpen());
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
