package com.priceintel.scraper.model;

import java.time.Instant;

/** Whether a store may start a tracking pass now; {@code nextAllowedAt} is set when refused for cadence. */
public record TrackingEligibility(boolean allowed, Instant nextAllowedAt, String reason) {

    public static TrackingEligibility allow() {
        return new TrackingEligibility(true, null, null);
    }

    public static TrackingEligibility refused(Instant nextAllowedAt, String reason) {
        return new TrackingEligibility(false, nextAllowedAt, reason);
    }
}
