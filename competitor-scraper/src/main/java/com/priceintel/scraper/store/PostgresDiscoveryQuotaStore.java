package com.priceintel.scraper.store;

import com.priceintel.scraper.model.DiscoveryQuota;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PostgresDiscoveryQuotaStore implements DiscoveryQuotaStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<DiscoveryQuota> find(String storeId, LocalDate periodStart) {
        return jdbcTemplate.query("""
                SELECT store_id, period_start, used, limit_amount
                FROM discovery_quota
                WHERE store_id = ? AND period_start = ?
                """,
                (rs, i) -> DiscoveryQuota.builder()
                        .storeId(rs.getString("store_id"))
                        .periodStart(JdbcRows.localDate(rs, "period_start"))
                        .used(rs.getInt("used"))
                        .limitAmount(rs.getInt("limit_amount"))
                        .build(),
                storeId, JdbcRows.date(periodStart))
                .stream()
                .findFirst();
    }

    @Override
    public void createIfAbsent(String storeId, LocalDate periodStart, int limitAmount) {
        jdbcTemplate.update("""
                INSERT INTO discovery_quota (store_id, period_start, used, limit_amount)
                VALUES (?, ?, 0, ?)
                ON CONFLICT (store_id, period_start) DO NOTHING
                """, storeId, JdbcRows.date(periodStart), limitAmount);
    }

    @Override
    public void updateLimit(String storeId, LocalDate periodStart, int limitAmount) {
        jdbcTemplate.update("""
                UPDATE discovery_quota
                SET limit_amount = ?, updated_at = NOW()
                WHERE store_id = ? AND period_start = ?
                """, limitAmount, storeId, JdbcRows.date(periodStart));
    }

    @Override
    public boolean tryConsume(String storeId, LocalDate periodStart, int amount) {
        int updated = jdbcTemplate.update("""
                UPDATE discovery_quota
                SET used = used + ?, updated_at = NOW()
                WHERE store_id = ? AND period_start = ? AND used + ? <= limit_amount
                """, amount, storeId, JdbcRows.date(periodStart), amount);
        return updated == 1;
    }
}
