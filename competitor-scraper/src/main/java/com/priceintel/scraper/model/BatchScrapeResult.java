package com.priceintel.scraper.model;

import java.util.List;

public record BatchScrapeResult(List<UrlResult> results,
                                int completed,
                                int deferred,
                                boolean budgetExhausted) {

    public record UrlResult(String url, ScrapeResult result) {}
}
