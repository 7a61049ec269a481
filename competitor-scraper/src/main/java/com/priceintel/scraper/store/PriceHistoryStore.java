package com.priceintel.scraper.store;

import com.priceintel.scraper.model.PriceHistoryEntry;

public interface PriceHistoryStore {

    void append(PriceHistoryEntry entry);
}
