package com.priceintel.scraper.model;

import java.math.BigDecimal;

/**
 * A product found on a competitor storefront. The URL doubles as the
 * candidate id since listing pages rarely expose a stable identifier.
 */
public record CandidateProduct(String id, String name, String sku, String url, BigDecimal price) {

    public static CandidateProduct fromListing(String name, String url, BigDecimal price) {
        return new CandidateProduct(url, name, null, url, price);
    }
}
