package com.priceintel.scraper.model;

/** A user/store pair that owns at least one active link. */
public record TrackingTarget(String userId, String storeId) {}
