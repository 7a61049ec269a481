package com.priceintel.scraper.service;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.BatchScrapeResult;
import com.priceintel.scraper.model.ScrapeOptions;
import com.priceintel.scraper.model.ScrapeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The only way paid fetches are made. Order of checks per call:
 * provider configured, budget admits the cost, fetch, then charge.
 * Failed fetches are never charged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetedScrapeService {

    private static final String BUDGET_EXHAUSTED = "Budget exhausted";

    private final ProviderClient providerClient;
    private final BudgetLedger budgetLedger;
    private final ScraperProperties properties;

    public ScrapeOptions defaultOptions() {
        ScraperProperties.Provider provider = properties.getProvider();
        return new ScrapeOptions(provider.isRenderJs(), provider.getTimeout(), 1, false);
    }

    public ScrapeResult scrape(String userId, String url) {
        return scrape(userId, url, defaultOptions());
    }

    public ScrapeResult scrape(String userId, String url, ScrapeOptions options) {
        if (options.cost() < 0) {
            throw new IllegalArgumentException("cost must be >= 0, was " + options.cost());
        }
        if (!properties.getProvider().isConfigured()) {
            log.error("Scraping provider is not configured (missing api key or base url)");
            return ScrapeResult.configurationError("Scraping provider not configured");
        }
        if (!options.skipBudgetCheck() && !budgetLedger.canScrape(userId, options.cost())) {
            log.warn("Budget exhausted for user {}, deferring {}", userId, url);
            return ScrapeResult.deferred(BUDGET_EXHAUSTED);
        }

        String body;
        try {
            body = providerClient.fetch(url, options.renderJs(), options.timeout());
        } catch (ProviderException e) {
            log.warn("Fetch of {} failed: {}", url, e.getMessage());
            return ScrapeResult.failure(e.getMessage());
        }

        budgetLedger.increment(userId, options.cost());
        return ScrapeResult.success(body, options.cost());
    }

    /**
     * Scrapes sequentially. Once one call is deferred for budget, every remaining URL
     * is reported deferred without a network call.
     */
    public BatchScrapeResult batchScrape(String userId, List<String> urls, ScrapeOptions options) {
        List<BatchScrapeResult.UrlResult> results = new ArrayList<>(urls.size());
        int completed = 0;
        int deferred = 0;
        boolean exhausted = false;

        for (String url : urls) {
            ScrapeResult result = exhausted
                    ? ScrapeResult.deferred(BUDGET_EXHAUSTED)
                    : scrape(userId, url, options);

            if (result.deferred()) {
                exhausted = true;
                deferred++;
            } else if (result.success()) {
                completed++;
            }
            results.add(new BatchScrapeResult.UrlResult(url, result));
        }

        if (exhausted) {
            log.info("Batch for user {}: {} completed, {} deferred on budget", userId, completed, deferred);
        }
        return new BatchScrapeResult(results, completed, deferred, exhausted);
    }
}
