package com.priceintel.scraper.store;

import com.priceintel.scraper.model.PriceHistoryEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PostgresPriceHistoryStore implements PriceHistoryStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void append(PriceHistoryEntry entry) {
        jdbcTemplate.update("""
                INSERT INTO competitor_price_history (link_id, price, currency, availability, recorded_at)
                VALUES (?, ?, ?, ?, ?)
                """,
                entry.getLinkId(),
                entry.getPrice(),
                entry.getCurrency(),
                entry.isAvailability(),
                JdbcRows.ts(entry.getRecordedAt()));
    }
}
