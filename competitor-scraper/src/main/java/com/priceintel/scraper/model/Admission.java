package com.priceintel.scraper.model;

/**
 * Answer of a synchronous gate (structural rate limit, plan limit).
 * {@code remaining} is -1 where the gate has no meaningful count.
 */
public record Admission(boolean allowed, int remaining, String reason) {

    public static Admission allow(int remaining) {
        return new Admission(true, remaining, null);
    }

    public static Admission refuse(int remaining, String reason) {
        return new Admission(false, remaining, reason);
    }
}
