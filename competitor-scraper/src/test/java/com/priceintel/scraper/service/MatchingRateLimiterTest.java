package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.RateLimitStatus;
import com.priceintel.scraper.store.RateLimitStore;
import com.priceintel.scraper.support.InMemoryRateLimitStore;
import com.priceintel.scraper.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchingRateLimiterTest {

    private static final String USER = "user-1";

    private final MutableClock clock = MutableClock.at("2024-05-10T08:00:00Z");
    private final MatchingRateLimiter limiter =
            new MatchingRateLimiter(new InMemoryRateLimitStore(), new ScraperProperties(), clock);

    @Mock
    RateLimitStore brokenStore;

    @Test
    void freshDayAllowsEverything() {
        RateLimitStatus status = limiter.getStatus(USER);

        assertThat(status.canRunHeavyMatching()).isTrue();
        assertThat(status.canAddCompetitorStore()).isTrue();
        assertThat(status.canAddUrls()).isTrue();
        assertThat(limiter.remainingUrlAdditions(USER)).isEqualTo(50);
    }

    @Test
    void oneHeavyRunPerDay() {
        limiter.recordHeavyMatching(USER);

        assertThat(limiter.canRunHeavyMatching(USER)).isFalse();
        assertThat(limiter.getStatus(USER).heavyMatchingCount()).isEqualTo(1);

        clock.advance(Duration.ofDays(1));
        assertThat(limiter.canRunHeavyMatching(USER)).isTrue();
    }

    @Test
    void oneNewCompetitorStorePerDay() {
        assertThat(limiter.canAddCompetitorStore(USER)).isTrue();
        limiter.recordCompetitorStoreAdded(USER);
        assertThat(limiter.canAddCompetitorStore(USER)).isFalse();
    }

    @Test
    void urlAdditionsCountAgainstDailyCap() {
        limiter.recordUrlsAdded(USER, 48);

        assertThat(limiter.remainingUrlAdditions(USER)).isEqualTo(2);
        assertThat(limiter.canAddUrls(USER, 2)).isTrue();
        assertThat(limiter.canAddUrls(USER, 3)).isFalse();

        limiter.recordUrlsAdded(USER, 2);
        assertThat(limiter.getStatus(USER).canAddUrls()).isFalse();
    }

    @Test
    void countersAreKeptPerUser() {
        limiter.recordHeavyMatching(USER);

        assertThat(limiter.canRunHeavyMatching("user-2")).isTrue();
    }

    @Test
    void negativeUrlCountIsRejected() {
        assertThatThrownBy(() -> limiter.recordUrlsAdded(USER, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storeFailureTreatsCountersAsZero() {
        when(brokenStore.find(anyString(), any())).thenThrow(new DataAccessResourceFailureException("down"));
        MatchingRateLimiter degraded = new MatchingRateLimiter(brokenStore, new ScraperProperties(), clock);

        assertThat(degraded.canRunHeavyMatching(USER)).isTrue();
        assertThat(degraded.remainingUrlAdditions(USER)).isEqualTo(50);
    }
}
