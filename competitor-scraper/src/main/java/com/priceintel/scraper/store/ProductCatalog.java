package com.priceintel.scraper.store;

import com.priceintel.scraper.model.LocalProduct;

import java.util.List;

/**
 * Read-only view of the merchant catalog (owned by the catalog sync, not by us).
 * Pages are taken over a stable ordering: most recently updated first.
 */
public interface ProductCatalog {

    List<LocalProduct> findActiveProducts(String storeId, int limit, int offset);

    int countActiveProducts(String storeId);
}
