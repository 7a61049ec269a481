package com.priceintel.scraper.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of a detected price change. Written only when the
 * tracked price differs from the previous one, not on every check.
 */
@Data
@Builder
public class PriceHistoryEntry {

    private String linkId;
    private BigDecimal price;
    private String currency;
    private boolean availability;
    private Instant recordedAt;
}
