package com.priceintel.scraper.store;

import com.priceintel.scraper.model.DiscoveryQuota;

import java.time.LocalDate;
import java.util.Optional;

public interface DiscoveryQuotaStore {

    Optional<DiscoveryQuota> find(String storeId, LocalDate periodStart);

    void createIfAbsent(String storeId, LocalDate periodStart, int limitAmount);

    void updateLimit(String storeId, LocalDate periodStart, int limitAmount);

    /**
     * Adds {@code amount} only if the result stays within the stored limit.
     *
     * @return true if the row was updated
     */
    boolean tryConsume(String storeId, LocalDate periodStart, int amount);
}
