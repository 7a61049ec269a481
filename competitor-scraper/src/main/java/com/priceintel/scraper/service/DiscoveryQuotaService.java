package com.priceintel.scraper.service;

import com.priceintel.scraper.model.DiscoveryQuota;
import com.priceintel.scraper.model.QuotaConsumption;
import com.priceintel.scraper.store.DiscoveryQuotaStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Monthly per-store discovery allowance, separate from the request budget.
 * The stored limit follows the store's current plan and is re-synced on read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiscoveryQuotaService {

    private final DiscoveryQuotaStore quotaStore;
    private final PlanEntitlements planEntitlements;
    private final Clock clock;

    public DiscoveryQuota getOrCreate(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("storeId is required");
        }
        LocalDate periodStart = LocalDate.now(clock).withDayOfMonth(1);
        int limit = planEntitlements.limitsFor(planEntitlements.tierForStore(storeId)).discoveryMonthlyLimit();

        quotaStore.createIfAbsent(storeId, periodStart, limit);
        DiscoveryQuota quota = quotaStore.find(storeId, periodStart)
                .orElseGet(() -> DiscoveryQuota.builder()
                        .storeId(storeId)
                        .periodStart(periodStart)
                        .limitAmount(limit)
                        .build());

        if (quota.getLimitAmount() != limit) {
            log.info("Discovery limit for store {} changed {} -> {}", storeId, quota.getLimitAmount(), limit);
            quotaStore.updateLimit(storeId, periodStart, limit);
            quota.setLimitAmount(limit);
        }
        return quota;
    }

    /** Consumes {@code amount} if it fits; a refusal leaves the stored count untouched. */
    public QuotaConsumption consume(String storeId, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, was " + amount);
        }
        DiscoveryQuota quota = getOrCreate(storeId);

        if (quota.getUsed() + amount > quota.getLimitAmount()
                || !quotaStore.tryConsume(storeId, quota.getPeriodStart(), amount)) {
            DiscoveryQuota current = quotaStore.find(storeId, quota.getPeriodStart()).orElse(quota);
            log.warn("Discovery quota refused for store {}: {} + {} > {}",
                    storeId, current.getUsed(), amount, current.getLimitAmount());
            return new QuotaConsumption(false, current.remaining(), current.getLimitAmount(), current.getUsed());
        }

        int used = quota.getUsed() + amount;
        return new QuotaConsumption(true, Math.max(0, quota.getLimitAmount() - used), quota.getLimitAmount(), used);
    }
}
