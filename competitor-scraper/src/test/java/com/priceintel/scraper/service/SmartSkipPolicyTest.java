package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SmartSkipPolicyTest {

    private static final Instant NOW = Instant.parse("2024-05-10T08:00:00Z");

    private final SmartSkipPolicy policy = new SmartSkipPolicy(new ScraperProperties());

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 1, 5})
    void belowSlowdownThreshold_noDelay(int streak) {
        assertThat(policy.nextAllowedCheck(streak, NOW)).isNull();
    }

    @ParameterizedTest
    @ValueSource(ints = {6, 7, 11})
    void stableItems_skipTwelveHours(int streak) {
        assertThat(policy.nextAllowedCheck(streak, NOW)).isEqualTo(NOW.plus(Duration.ofHours(12)));
    }

    @ParameterizedTest
    @ValueSource(ints = {12, 13, 500})
    void veryStableItems_skipThirtySixHours(int streak) {
        assertThat(policy.nextAllowedCheck(streak, NOW)).isEqualTo(NOW.plus(Duration.ofHours(36)));
    }

    @Test
    void thresholdsFollowConfiguration() {
        ScraperProperties props = new ScraperProperties();
        props.getSmartSkip().setSlowdownStreak(2);
        props.getSmartSkip().setSlowdownSkip(Duration.ofHours(1));
        SmartSkipPolicy custom = new SmartSkipPolicy(props);

        assertThat(custom.nextAllowedCheck(1, NOW)).isNull();
        assertThat(custom.nextAllowedCheck(2, NOW)).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }
}
