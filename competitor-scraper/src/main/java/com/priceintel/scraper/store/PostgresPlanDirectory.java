package com.priceintel.scraper.store;

import com.priceintel.scraper.model.PlanProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PostgresPlanDirectory implements PlanDirectory {

    private static final RowMapper<PlanProfile> MAPPER = (rs, i) -> new PlanProfile(
            rs.getString("id"),
            rs.getString("plan"),
            JdbcRows.instant(rs, "created_at"),
            JdbcRows.instant(rs, "trial_ends_at"));

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<PlanProfile> findByUserId(String userId) {
        return jdbcTemplate.query("""
                SELECT id::text AS id, plan, created_at, trial_ends_at
                FROM profiles
                WHERE id = ?::uuid
                """, MAPPER, userId)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<PlanProfile> findByStoreId(String storeId) {
        return jdbcTemplate.query("""
                SELECT p.id::text AS id, p.plan, p.created_at, p.trial_ends_at
                FROM stores s
                JOIN profiles p ON p.id = s.owner_id
                WHERE s.id = ?::uuid
                """, MAPPER, storeId)
                .stream()
                .findFirst();
    }
}
