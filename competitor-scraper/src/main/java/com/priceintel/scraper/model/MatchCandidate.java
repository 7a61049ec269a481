package com.priceintel.scraper.model;

/** @param similarity 0-100 */
public record MatchCandidate(String productId, String competitorProductId, int similarity) {}
