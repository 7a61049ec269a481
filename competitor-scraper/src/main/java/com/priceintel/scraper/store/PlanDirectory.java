package com.priceintel.scraper.store;

import com.priceintel.scraper.model.PlanProfile;

import java.util.Optional;

/** Read-only lookup of the account plan behind a user or a store. */
public interface PlanDirectory {

    Optional<PlanProfile> findByUserId(String userId);

    Optional<PlanProfile> findByStoreId(String storeId);
}
