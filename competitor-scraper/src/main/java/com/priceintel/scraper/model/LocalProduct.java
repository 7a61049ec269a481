package com.priceintel.scraper.model;

/** A merchant catalog entry as seen by the matcher. */
public record LocalProduct(String id, String name, String sku) {}
