package com.priceintel.scraper.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate counts of one tracking pass. Used by callers for logging and job
 * bookkeeping; the per-link state is what gets persisted.
 */
@Data
public class TrackingJobResult {

    private final String userId;
    private final String storeId;
    private int linksProcessed;
    private int linksDeferred;
    private int priceChanges;
    private int errors;
    private boolean budgetExhausted;
    private boolean configurationError;
    private final List<TrackingResult> results = new ArrayList<>();

    public void add(TrackingResult result) {
        results.add(result);
        if (result.deferred()) {
            linksDeferred++;
        } else if (!result.success()) {
            errors++;
        } else {
            linksProcessed++;
            if (result.priceChanged()) priceChanges++;
        }
    }
}
