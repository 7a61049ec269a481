package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
public class RetryBackoffPolicy {

    private final ScraperProperties properties;

    /**
     * streak &lt;= 0 gives {@code now}; past maxRetries the link drops to the exhausted
     * backoff; otherwise the backoff table is indexed by streak - 1, clamped to its last entry.
     */
    public Instant nextRetryTime(int errorStreak, Instant now) {
        if (errorStreak <= 0) {
            return now;
        }
        ScraperProperties.RetryPolicy cfg = properties.getRetry();
        if (isExhausted(errorStreak)) {
            return now.plus(cfg.getExhaustedBackoff());
        }
        List<Duration> table = cfg.getBackoff();
        if (table == null || table.isEmpty()) {
            return now;
        }
        int index = Math.min(errorStreak - 1, table.size() - 1);
        return now.plus(table.get(index));
    }

    public boolean isExhausted(int errorStreak) {
        return errorStreak > properties.getRetry().getMaxRetries();
    }
}
