package com.priceintel.scraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "price-scraper")
@Data
public class ScraperProperties {

    private Provider provider = new Provider();
    private Budget budget = new Budget();
    private Plans plans = new Plans();
    private Matching matching = new Matching();
    private RetryPolicy retry = new RetryPolicy();
    private SmartSkip smartSkip = new SmartSkip();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Provider {
        private String baseUrl = "https://app.scrapingbee.com/api/v1";
        private String apiKey = "";
        private boolean renderJs = false;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && baseUrl != null && !baseUrl.isBlank();
        }
    }

    /**
     * Cost model. Request caps are derived, never configured directly:
     * monthly = floor(budget / costPer1000 * 1000), daily = floor(monthly / 30).
     */
    @Data
    public static class Budget {
        private BigDecimal costPer1000RequestsUsd = new BigDecimal("1.5");
        private BigDecimal monthlyBudgetUsdPerUser = new BigDecimal("30");
        private boolean failOpen = true;

        public int monthlyRequestLimit() {
            if (costPer1000RequestsUsd.signum() <= 0) {
                return Integer.MAX_VALUE;
            }
            BigDecimal requests = monthlyBudgetUsdPerUser
                    .multiply(BigDecimal.valueOf(1000))
                    .divide(costPer1000RequestsUsd, 0, RoundingMode.FLOOR);
            return requests.min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValue();
        }

        public int dailyRequestLimit() {
            return monthlyRequestLimit() / 30;
        }
    }

    @Data
    public static class Plans {
        private int trialDays = 14;
        private PlanLimitsConfig freeDemo = new PlanLimitsConfig(0, 50, 1, 0);
        private PlanLimitsConfig starter = new PlanLimitsConfig(1, 50, 2, 2000);
        private PlanLimitsConfig pro = new PlanLimitsConfig(2, 200, 5, 6000);
        private PlanLimitsConfig scale = new PlanLimitsConfig(4, 400, 10, 6000);
    }

    @Data
    public static class PlanLimitsConfig {
        private int trackingRunsPerDay;
        private int productsLimit;
        private int competitorsPerProduct;
        private int discoveryMonthlyLimit;

        public PlanLimitsConfig() {
        }

        public PlanLimitsConfig(int trackingRunsPerDay, int productsLimit,
                                int competitorsPerProduct, int discoveryMonthlyLimit) {
            this.trackingRunsPerDay = trackingRunsPerDay;
            this.productsLimit = productsLimit;
            this.competitorsPerProduct = competitorsPerProduct;
            this.discoveryMonthlyLimit = discoveryMonthlyLimit;
        }
    }

    @Data
    public static class Matching {
        private int batchSize = 25;
        private int quickStartCount = 30;
        private int minScore = 60;
        private int highConfidenceScore = 90;
        private Duration batchDelay = Duration.ofMinutes(5);
        private int heavyMatchingRunsPerDay = 1;
        private int maxNewCompetitorStoresPerDay = 1;
        private int maxUrlAdditionsPerDay = 50;
        private int listingMaxPages = 1;
    }

    @Data
    public static class RetryPolicy {
        private int maxRetries = 2;
        private List<Duration> backoff = new ArrayList<>(List.of(Duration.ofSeconds(60), Duration.ofSeconds(300)));
        private Duration exhaustedBackoff = Duration.ofHours(24);
    }

    @Data
    public static class SmartSkip {
        // At 2 runs/day: 6 unchanged checks = 3 days, 12 = 6 days
        private int slowdownStreak = 6;
        private int heavySlowdownStreak = 12;
        private Duration slowdownSkip = Duration.ofHours(12);
        private Duration heavySlowdownSkip = Duration.ofHours(36);
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String trackingCron = "0 0 * * * *";
        private Duration jobPollInterval = Duration.ofSeconds(60);
        private int jobsPerPoll = 10;
        private boolean runOnStartup = false;
    }
}
