package com.priceintel.scraper.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One tracked competitor page for one of our products.
 *
 * Identity fields are written once (matching or manual add). Everything under
 * "tracking state" is owned by the tracking pass.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompetitorProductLink {

    // ── Identity ────────────────────────────────────────────────────────────
    private String id;
    private String userId;
    private String storeId;
    private String productId;
    private String competitorId;
    private String competitorProductId;
    private String url;

    // ── Tracking state ──────────────────────────────────────────────────────
    private BigDecimal lastPrice;
    private String lastCurrency;
    private Boolean lastAvailability;
    private Instant lastCheckedAt;
    private Instant lastChangedAt;
    private Instant lastErrorAt;
    private String lastErrorMessage;
    private int noChangeStreak;
    private int errorStreak;

    /** null = no artificial delay, due whenever the plan cadence runs */
    private Instant nextAllowedCheckAt;

    @Builder.Default
    private boolean active = true;
    private boolean needsAttention;
    private int priority;
}
