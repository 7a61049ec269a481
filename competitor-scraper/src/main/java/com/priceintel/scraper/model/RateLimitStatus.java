package com.priceintel.scraper.model;

public record RateLimitStatus(boolean canRunHeavyMatching,
                              boolean canAddCompetitorStore,
                              boolean canAddUrls,
                              int heavyMatchingCount,
                              int competitorStoresAdded,
                              int urlsAdded) {}
