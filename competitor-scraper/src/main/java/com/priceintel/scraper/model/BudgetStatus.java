package com.priceintel.scraper.model;

/**
 * Snapshot of a user's budget against the derived request caps.
 *
 * @param storeAvailable false when the snapshot could not be read from the store
 *                       and was synthesised by the ledger's fail-open/fail-closed policy
 */
public record BudgetStatus(int dailyUsed,
                           int dailyLimit,
                           int monthlyUsed,
                           int monthlyLimit,
                           boolean storeAvailable,
                           boolean canScrape) {

    public static BudgetStatus of(int dailyUsed, int dailyLimit, int monthlyUsed, int monthlyLimit) {
        return new BudgetStatus(dailyUsed, dailyLimit, monthlyUsed, monthlyLimit, true,
                dailyUsed < dailyLimit && monthlyUsed < monthlyLimit);
    }

    public static BudgetStatus unavailable(int dailyLimit, int monthlyLimit, boolean failOpen) {
        return new BudgetStatus(0, dailyLimit, 0, monthlyLimit, false, failOpen);
    }

    public int dailyRemaining() {
        return Math.max(0, dailyLimit - dailyUsed);
    }

    public int monthlyRemaining() {
        return Math.max(0, monthlyLimit - monthlyUsed);
    }

    public boolean admits(int cost) {
        if (!storeAvailable) return canScrape;
        return dailyUsed + cost <= dailyLimit && monthlyUsed + cost <= monthlyLimit;
    }
}
