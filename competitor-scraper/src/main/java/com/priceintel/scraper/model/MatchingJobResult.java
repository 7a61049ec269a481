package com.priceintel.scraper.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a quick-start or batch matching run. {@code refusal} is set when a
 * structural rate limit turned the run away before any paid work.
 */
@Data
@Builder
public class MatchingJobResult {

    private String userId;
    private String storeId;
    private String competitorId;
    private int productsMatched;
    private int productsDeferred;
    private int batchesQueued;
    private boolean budgetExhausted;
    private boolean quickStart;
    private int batchNumber;
    private int totalBatches;
    private String refusal;

    public boolean isRefused() {
        return refusal != null;
    }
}
