package com.priceintel.scraper.model;

import java.util.Locale;

/**
 * Subscription tiers. Raw plan strings from the profile table are loose
 * (upper/lower case, legacy aliases), so everything goes through {@link #from(String)}.
 */
public enum PlanTier {
    FREE_DEMO,
    STARTER,
    PRO,
    SCALE;

    public static PlanTier from(String raw) {
        if (raw == null) return FREE_DEMO;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "starter", "basic" -> STARTER;
            case "pro", "professional" -> PRO;
            case "scale", "ultra", "enterprise" -> SCALE;
            default -> FREE_DEMO;
        };
    }
}
