package com.priceintel.scraper.model;

import java.util.List;

/**
 * Candidates read from a competitor storefront. {@code deferred} means the budget ran
 * out before the listing could be (fully) read; whatever was collected is kept.
 */
public record ListingScrapeResult(List<CandidateProduct> candidates,
                                  boolean deferred,
                                  boolean configurationError,
                                  String error) {

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
