package com.priceintel.scraper.service;

import com.priceintel.scraper.model.Admission;
import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.PlanLimits;
import com.priceintel.scraper.store.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/** Manual "track this competitor page for my product" additions. */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompetitorUrlService {

    private final LinkStore linkStore;
    private final MatchingRateLimiter rateLimiter;
    private final PlanEntitlements planEntitlements;

    public Admission addCompetitorUrl(String userId, String storeId, String productId,
                                      String competitorId, String url) {
        requireText(userId, "userId");
        requireText(storeId, "storeId");
        requireText(productId, "productId");
        requireText(competitorId, "competitorId");
        validateUrl(url);

        int remaining = rateLimiter.remainingUrlAdditions(userId);
        if (remaining < 1) {
            log.warn("User {} reached the daily URL addition limit", userId);
            return Admission.refuse(0, "Daily URL addition limit reached");
        }

        // Updating the URL of an already active pair does not take a new slot.
        PlanLimits limits = planEntitlements.limitsFor(planEntitlements.tierForUser(userId));
        if (!linkStore.hasActiveLink(productId, competitorId)
                && linkStore.countActiveForProduct(productId) >= limits.competitorsPerProduct()) {
            return Admission.refuse(remaining,
                    "Plan " + limits.tier() + " allows " + limits.competitorsPerProduct() + " competitors per product");
        }

        linkStore.upsert(List.of(CompetitorProductLink.builder()
                .userId(userId)
                .storeId(storeId)
                .productId(productId)
                .competitorId(competitorId)
                .url(url.trim())
                .priority(0)
                .build()));
        rateLimiter.recordUrlsAdded(userId, 1);

        log.info("Competitor URL added for product {} (competitor {})", productId, competitorId);
        return Admission.allow(remaining - 1);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static void validateUrl(String url) {
        requireText(url, "url");
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
