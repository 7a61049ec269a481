package com.priceintel.scraper.model;

public record PlanLimits(PlanTier tier,
                         int trackingRunsPerDay,
                         int productsLimit,
                         int competitorsPerProduct,
                         int discoveryMonthlyLimit) {

    public boolean trackingEnabled() {
        return trackingRunsPerDay > 0;
    }
}
