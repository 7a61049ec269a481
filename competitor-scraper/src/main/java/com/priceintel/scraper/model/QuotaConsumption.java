package com.priceintel.scraper.model;

/** Result of a discovery-quota consume; when refused, {@code used} is the unchanged stored value. */
public record QuotaConsumption(boolean allowed, int remaining, int limit, int used) {}
