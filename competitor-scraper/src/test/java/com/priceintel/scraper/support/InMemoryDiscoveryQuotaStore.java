package com.priceintel.scraper.support;

import com.priceintel.scraper.model.DiscoveryQuota;
import com.priceintel.scraper.store.DiscoveryQuotaStore;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryDiscoveryQuotaStore implements DiscoveryQuotaStore {

    private final Map<String, DiscoveryQuota> rows = new HashMap<>();

    public void put(DiscoveryQuota quota) {
        rows.put(key(quota.getStoreId(), quota.getPeriodStart()), copy(quota));
    }

    @Override
    public Optional<DiscoveryQuota> find(String storeId, LocalDate periodStart) {
        return Optional.ofNullable(rows.get(key(storeId, periodStart))).map(InMemoryDiscoveryQuotaStore::copy);
    }

    @Override
    public void createIfAbsent(String storeId, LocalDate periodStart, int limitAmount) {
        rows.putIfAbsent(key(storeId, periodStart), DiscoveryQuota.builder()
                .storeId(storeId)
                .periodStart(periodStart)
                .limitAmount(limitAmount)
                .build());
    }

    @Override
    public void updateLimit(String storeId, LocalDate periodStart, int limitAmount) {
        DiscoveryQuota q = rows.get(key(storeId, periodStart));
        if (q != null) q.setLimitAmount(limitAmount);
    }

    @Override
    public boolean tryConsume(String storeId, LocalDate periodStart, int amount) {
        DiscoveryQuota q = rows.get(key(storeId, periodStart));
        if (q == null || q.getUsed() + amount > q.getLimitAmount()) return false;
        q.setUsed(q.getUsed() + amount);
        return true;
    }

    private static String key(String storeId, LocalDate periodStart) {
        return storeId + "|" + periodStart;
    }

    private static DiscoveryQuota copy(DiscoveryQuota q) {
        return new DiscoveryQuota(q.getStoreId(), q.getPeriodStart(), q.getUsed(), q.getLimitAmount());
    }
}
