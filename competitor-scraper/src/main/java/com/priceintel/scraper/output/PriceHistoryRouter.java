package com.priceintel.scraper.output;

import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.PriceHistoryEntry;
import com.priceintel.scraper.store.PriceHistoryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes price-change records to the configured sink(s).
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@RequiredArgsConstructor
public class PriceHistoryRouter {

    private final PriceHistoryStore priceHistoryStore;
    private final PriceHistoryCsvWriter csvWriter;
    private final ScraperProperties properties;

    public void record(PriceHistoryEntry entry) {
        switch (properties.getOutput().getMode()) {
            case DATABASE -> priceHistoryStore.append(entry);
            case CSV -> csvWriter.write(entry);
            case BOTH -> {
                priceHistoryStore.append(entry);
                csvWriter.write(entry);
            }
        }
    }
}
