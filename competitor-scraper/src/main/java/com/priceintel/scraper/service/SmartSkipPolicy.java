package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Slows polling of links whose price has not moved for a while.
 * A null result means no artificial delay: the link is due on every tracking pass.
 */
@Component
@RequiredArgsConstructor
public class SmartSkipPolicy {

    private final ScraperProperties properties;

    public Instant nextAllowedCheck(int noChangeStreak, Instant now) {
        ScraperProperties.SmartSkip cfg = properties.getSmartSkip();
        if (noChangeStreak >= cfg.getHeavySlowdownStreak()) {
            return now.plus(cfg.getHeavySlowdownSkip());
        }
        if (noChangeStreak >= cfg.getSlowdownStreak()) {
            return now.plus(cfg.getSlowdownSkip());
        }
        return null;
    }
}
