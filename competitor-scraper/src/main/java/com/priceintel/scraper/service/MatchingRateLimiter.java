package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.MatchingRateLimit;
import com.priceintel.scraper.model.RateLimitStatus;
import com.priceintel.scraper.store.RateLimitStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily caps on structural operations: heavy matching runs, new competitor stores
 * and URL additions. Checks are pure reads; callers record usage only after the
 * gated action succeeded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MatchingRateLimiter {

    private final RateLimitStore rateLimitStore;
    private final ScraperProperties properties;
    private final Clock clock;

    public RateLimitStatus getStatus(String userId) {
        MatchingRateLimit today = today(userId);
        ScraperProperties.Matching cfg = properties.getMatching();
        return new RateLimitStatus(
                today.getHeavyMatchingCount() < cfg.getHeavyMatchingRunsPerDay(),
                today.getCompetitorStoresAdded() < cfg.getMaxNewCompetitorStoresPerDay(),
                today.getUrlsAdded() < cfg.getMaxUrlAdditionsPerDay(),
                today.getHeavyMatchingCount(),
                today.getCompetitorStoresAdded(),
                today.getUrlsAdded());
    }

    public boolean canRunHeavyMatching(String userId) {
        return today(userId).getHeavyMatchingCount() < properties.getMatching().getHeavyMatchingRunsPerDay();
    }

    public boolean canAddCompetitorStore(String userId) {
        return today(userId).getCompetitorStoresAdded() < properties.getMatching().getMaxNewCompetitorStoresPerDay();
    }

    public boolean canAddUrls(String userId, int count) {
        return count <= remainingUrlAdditions(userId);
    }

    public int remainingUrlAdditions(String userId) {
        return Math.max(0, properties.getMatching().getMaxUrlAdditionsPerDay() - today(userId).getUrlsAdded());
    }

    public void recordHeavyMatching(String userId) {
        record(userId, MatchingRateLimit.Counter.HEAVY_MATCHING, 1);
    }

    public void recordCompetitorStoreAdded(String userId) {
        record(userId, MatchingRateLimit.Counter.COMPETITOR_STORES_ADDED, 1);
    }

    public void recordUrlsAdded(String userId, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, was " + count);
        }
        record(userId, MatchingRateLimit.Counter.URLS_ADDED, count);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private MatchingRateLimit today(String userId) {
        LocalDate day = LocalDate.now(clock);
        try {
            return rateLimitStore.find(userId, day).orElseGet(() -> {
                rateLimitStore.createIfAbsent(userId, day);
                return rateLimitStore.find(userId, day).orElseGet(() -> empty(userId, day));
            });
        } catch (DataAccessException e) {
            log.warn("Rate limit lookup failed for user {}, treating counters as zero: {}", userId, e.getMessage());
            return empty(userId, day);
        }
    }

    private void record(String userId, MatchingRateLimit.Counter counter, int amount) {
        try {
            rateLimitStore.increment(userId, LocalDate.now(clock), counter, amount);
        } catch (DataAccessException e) {
            log.warn("Could not record {} for user {}: {}", counter, userId, e.getMessage());
        }
    }

    private static MatchingRateLimit empty(String userId, LocalDate day) {
        return MatchingRateLimit.builder().userId(userId).runDate(day).build();
    }
}
