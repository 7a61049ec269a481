package com.priceintel.scraper.store;

import com.priceintel.scraper.model.MatchingRateLimit;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PostgresRateLimitStore implements RateLimitStore {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<MatchingRateLimit> find(String userId, LocalDate day) {
        return jdbcTemplate.query("""
                SELECT user_id, run_date, heavy_matching_count, competitor_stores_added, urls_added
                FROM matching_rate_limit
                WHERE user_id = ? AND run_date = ?
                """,
                (rs, i) -> MatchingRateLimit.builder()
                        .userId(rs.getString("user_id"))
                        .runDate(JdbcRows.localDate(rs, "run_date"))
                        .heavyMatchingCount(rs.getInt("heavy_matching_count"))
                        .competitorStoresAdded(rs.getInt("competitor_stores_added"))
                        .urlsAdded(rs.getInt("urls_added"))
                        .build(),
                userId, JdbcRows.date(day))
                .stream()
                .findFirst();
    }

    @Override
    public void createIfAbsent(String userId, LocalDate day) {
        jdbcTemplate.update("""
                INSERT INTO matching_rate_limit (user_id, run_date)
                VALUES (?, ?)
                ON CONFLICT (user_id, run_date) DO NOTHING
                """, userId, JdbcRows.date(day));
    }

    @Override
    public void increment(String userId, LocalDate day, MatchingRateLimit.Counter counter, int amount) {
        // Column name comes from the enum, never from input
        String column = counter.column();
        jdbcTemplate.update(
                "INSERT INTO matching_rate_limit (user_id, run_date, " + column + ") VALUES (?, ?, ?) "
                        + "ON CONFLICT (user_id, run_date) DO UPDATE SET "
                        + column + " = matching_rate_limit." + column + " + EXCLUDED." + column
                        + ", updated_at = NOW()",
                userId, JdbcRows.date(day), amount);
    }
}
