package com.priceintel.scraper.support;

import com.priceintel.scraper.model.LocalProduct;
import com.priceintel.scraper.store.ProductCatalog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Products per store, kept in insertion order as the "most recently updated first" ordering. */
public class InMemoryProductCatalog implements ProductCatalog {

    private final Map<String, List<LocalProduct>> byStore = new HashMap<>();

    public void add(String storeId, LocalProduct product) {
        byStore.computeIfAbsent(storeId, k -> new ArrayList<>()).add(product);
    }

    @Override
    public List<LocalProduct> findActiveProducts(String storeId, int limit, int offset) {
        List<LocalProduct> all = byStore.getOrDefault(storeId, List.of());
        if (offset >= all.size()) return List.of();
        return List.copyOf(all.subList(offset, Math.min(all.size(), offset + limit)));
    }

    @Override
    public int countActiveProducts(String storeId) {
        return byStore.getOrDefault(storeId, List.of()).size();
    }
}
