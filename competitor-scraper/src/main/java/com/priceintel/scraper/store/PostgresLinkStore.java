package com.priceintel.scraper.store;

import com.priceintel.scraper.model.CompetitorProductLink;
import com.priceintel.scraper.model.TrackingTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Repository
@Slf4j
@RequiredArgsConstructor
public class PostgresLinkStore implements LinkStore {

    private static final RowMapper<CompetitorProductLink> MAPPER = (rs, i) -> CompetitorProductLink.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .storeId(rs.getString("store_id"))
            .productId(rs.getString("product_id"))
            .competitorId(rs.getString("competitor_id"))
            .competitorProductId(rs.getString("competitor_product_id"))
            .url(rs.getString("url"))
            .lastPrice(rs.getBigDecimal("last_price"))
            .lastCurrency(rs.getString("last_currency"))
            .lastAvailability(JdbcRows.nullableBoolean(rs, "last_availability"))
            .lastCheckedAt(JdbcRows.instant(rs, "last_checked_at"))
            .lastChangedAt(JdbcRows.instant(rs, "last_changed_at"))
            .lastErrorAt(JdbcRows.instant(rs, "last_error_at"))
            .lastErrorMessage(rs.getString("last_error_message"))
            .noChangeStreak(rs.getInt("no_change_streak"))
            .errorStreak(rs.getInt("error_streak"))
            .nextAllowedCheckAt(JdbcRows.instant(rs, "next_allowed_check_at"))
            .active(rs.getBoolean("is_active"))
            .needsAttention(rs.getBoolean("needs_attention"))
            .priority(rs.getInt("priority"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<CompetitorProductLink> findDue(String userId, String storeId, Instant now,
                                               Instant passStartedAt, int limit) {
        return jdbcTemplate.query("""
                SELECT *
                FROM competitor_product_link
                WHERE user_id = ?
                  AND store_id = ?
                  AND is_active
                  AND url IS NOT NULL
                  AND (next_allowed_check_at IS NULL OR next_allowed_check_at <= ?)
                  AND (last_checked_at IS NULL OR last_checked_at < ?)
                ORDER BY last_checked_at ASC NULLS FIRST, priority DESC, id
                LIMIT ?
                """, MAPPER, userId, storeId, JdbcRows.ts(now), JdbcRows.ts(passStartedAt), limit);
    }

    @Override
    public int countTrackable(String userId, String storeId) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT count(*)
                FROM competitor_product_link
                WHERE user_id = ? AND store_id = ? AND is_active AND url IS NOT NULL
                """, Integer.class, userId, storeId);
        return count == null ? 0 : count;
    }

    @Override
    public List<TrackingTarget> findTrackingTargets() {
        return jdbcTemplate.query("""
                SELECT DISTINCT user_id, store_id
                FROM competitor_product_link
                WHERE is_active AND url IS NOT NULL
                ORDER BY user_id, store_id
                """, (rs, i) -> new TrackingTarget(rs.getString("user_id"), rs.getString("store_id")));
    }

    @Override
    public void saveTrackingState(CompetitorProductLink link) {
        jdbcTemplate.update("""
                UPDATE competitor_product_link
                SET last_price = ?,
                    last_currency = ?,
                    last_availability = ?,
                    last_checked_at = ?,
                    last_changed_at = ?,
                    last_error_at = ?,
                    last_error_message = ?,
                    no_change_streak = ?,
                    error_streak = ?,
                    next_allowed_check_at = ?,
                    needs_attention = ?,
                    updated_at = NOW()
                WHERE id = ?
                """,
                link.getLastPrice(),
                link.getLastCurrency(),
                link.getLastAvailability(),
                JdbcRows.ts(link.getLastCheckedAt()),
                JdbcRows.ts(link.getLastChangedAt()),
                JdbcRows.ts(link.getLastErrorAt()),
                link.getLastErrorMessage(),
                link.getNoChangeStreak(),
                link.getErrorStreak(),
                JdbcRows.ts(link.getNextAllowedCheckAt()),
                link.isNeedsAttention(),
                link.getId());
    }

    @Override
    public int upsert(List<CompetitorProductLink> links) {
        if (links.isEmpty()) return 0;

        List<Object[]> rows = links.stream()
                .map(l -> new Object[]{
                        l.getId() != null ? l.getId() : UUID.randomUUID().toString(),
                        l.getUserId(),
                        l.getStoreId(),
                        l.getProductId(),
                        l.getCompetitorId(),
                        l.getCompetitorProductId(),
                        l.getUrl(),
                        l.getPriority()
                })
                .toList();

        jdbcTemplate.batchUpdate("""
                INSERT INTO competitor_product_link
                (id, user_id, store_id, product_id, competitor_id, competitor_product_id, url, is_active, priority)
                VALUES (?, ?, ?, ?, ?, ?, ?, TRUE, ?)
                ON CONFLICT (product_id, competitor_id) DO UPDATE
                SET url = EXCLUDED.url,
                    competitor_product_id = EXCLUDED.competitor_product_id,
                    priority = EXCLUDED.priority,
                    is_active = TRUE,
                    updated_at = NOW()
                """, rows);

        log.debug("Upserted {} competitor product links", rows.size());
        return rows.size();
    }

    @Override
    public Set<String> findLinkedProductIds(String competitorId, Collection<String> productIds) {
        if (productIds.isEmpty()) return Set.of();

        NamedParameterJdbcTemplate named = new NamedParameterJdbcTemplate(jdbcTemplate);
        List<String> linked = named.queryForList("""
                SELECT product_id
                FROM competitor_product_link
                WHERE competitor_id = :competitorId AND product_id IN (:productIds)
                """,
                new MapSqlParameterSource()
                        .addValue("competitorId", competitorId)
                        .addValue("productIds", productIds),
                String.class);
        return new HashSet<>(linked);
    }

    @Override
    public boolean hasActiveLink(String productId, String competitorId) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT count(*) FROM competitor_product_link
                WHERE product_id = ? AND competitor_id = ? AND is_active
                """, Integer.class, productId, competitorId);
        return count != null && count > 0;
    }

    @Override
    public int countActiveForProduct(String productId) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT count(*) FROM competitor_product_link WHERE product_id = ? AND is_active
                """, Integer.class, productId);
        return count == null ? 0 : count;
    }
}
