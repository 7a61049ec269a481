package com.priceintel.scraper.model;

import java.time.Instant;

/**
 * Plan data read from the account profile. {@code trialEndsAt} is optional;
 * when absent the trial is derived from {@code createdAt}.
 */
public record PlanProfile(String userId, String rawPlan, Instant createdAt, Instant trialEndsAt) {}
