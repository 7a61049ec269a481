package com.priceintel.scraper.store;

import com.priceintel.scraper.model.MatchingRateLimit;

import java.time.LocalDate;
import java.util.Optional;

public interface RateLimitStore {

    Optional<MatchingRateLimit> find(String userId, LocalDate day);

    void createIfAbsent(String userId, LocalDate day);

    void increment(String userId, LocalDate day, MatchingRateLimit.Counter counter, int amount);
}
