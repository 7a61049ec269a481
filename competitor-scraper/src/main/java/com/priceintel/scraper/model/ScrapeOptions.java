package com.priceintel.scraper.model;

import java.time.Duration;

/** Per-call overrides of the provider defaults. */
public record ScrapeOptions(boolean renderJs, Duration timeout, int cost, boolean skipBudgetCheck) {

    public ScrapeOptions withCost(int newCost) {
        return new ScrapeOptions(renderJs, timeout, newCost, skipBudgetCheck);
    }

    public ScrapeOptions skippingBudgetCheck() {
        return new ScrapeOptions(renderJs, timeout, cost, true);
    }
}
