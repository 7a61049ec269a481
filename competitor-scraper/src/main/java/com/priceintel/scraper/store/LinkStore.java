package com.priceintel.scraper.store;

import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.TrackingTarget;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface LinkStore {

    /**
     * Active links with a URL whose {@code nextAllowedCheckAt} is unset or past,
     * and that have not been checked since {@code passStartedAt}.
     * Ordered by {@code lastCheckedAt} ascending (never-checked first), then priority descending.
     */
    List<CompetitorProductLink> findDue(String userId, String storeId, Instant now,
                                        Instant passStartedAt, int limit);

    int countTrackable(String userId, String storeId);

    List<TrackingTarget> findTrackingTargets();

    /** Writes the tracking-state columns of an existing link. */
    void saveTrackingState(CompetitorProductLink link);

    /**
     * Inserts links keyed by (productId, competitorId). On conflict the URL,
     * competitor product id and priority are refreshed and the row is
     * reactivated; tracking state of the existing row is kept.
     *
     * @return number of rows written
     */
    int upsert(List<CompetitorProductLink> links);

    Set<String> findLinkedProductIds(String competitorId, Collection<String> productIds);

    boolean hasActiveLink(String productId, String competitorId);

    int countActiveForProduct(String productId);
}
