package com.priceintel.scraper.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the tables owned by the scraper. The catalog tables it reads
 * (products, profiles, stores) belong to the web application and are not touched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring scraper schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_budget
            (
                user_id             TEXT PRIMARY KEY,
                daily_used          INTEGER NOT NULL DEFAULT 0,
                daily_date          DATE NOT NULL,
                monthly_used        INTEGER NOT NULL DEFAULT 0,
                month_period_start  DATE NOT NULL,
                updated_at          TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS competitor_product_link
            (
                id                      TEXT PRIMARY KEY,
                user_id                 TEXT NOT NULL,
                store_id                TEXT NOT NULL,
                product_id              TEXT NOT NULL,
                competitor_id           TEXT NOT NULL,
                competitor_product_id   TEXT,
                url                     TEXT,
                last_price              NUMERIC(12, 2),
                last_currency           TEXT,
                last_availability       BOOLEAN,
                last_checked_at         TIMESTAMPTZ,
                last_changed_at         TIMESTAMPTZ,
                last_error_at           TIMESTAMPTZ,
                last_error_message      TEXT,
                no_change_streak        INTEGER NOT NULL DEFAULT 0,
                error_streak            INTEGER NOT NULL DEFAULT 0,
                next_allowed_check_at   TIMESTAMPTZ,
                is_active               BOOLEAN NOT NULL DEFAULT TRUE,
                needs_attention         BOOLEAN NOT NULL DEFAULT FALSE,
                priority                INTEGER NOT NULL DEFAULT 0,
                created_at              TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at              TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                UNIQUE (product_id, competitor_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_cpl_due
            ON competitor_product_link (user_id, store_id, next_allowed_check_at)
            WHERE is_active AND url IS NOT NULL
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS competitor_price_history
            (
                id              BIGSERIAL PRIMARY KEY,
                link_id         TEXT NOT NULL REFERENCES competitor_product_link (id) ON DELETE CASCADE,
                price           NUMERIC(12, 2) NOT NULL,
                currency        TEXT NOT NULL DEFAULT 'USD',
                availability    BOOLEAN NOT NULL DEFAULT TRUE,
                recorded_at     TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
        """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_cph_link_recorded
            ON competitor_price_history (link_id, recorded_at DESC)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS matching_rate_limit
            (
                user_id                 TEXT NOT NULL,
                run_date                DATE NOT NULL,
                heavy_matching_count    INTEGER NOT NULL DEFAULT 0,
                competitor_stores_added INTEGER NOT NULL DEFAULT 0,
                urls_added              INTEGER NOT NULL DEFAULT 0,
                updated_at              TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (user_id, run_date)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scrape_job
            (
                id              TEXT PRIMARY KEY,
                user_id         TEXT NOT NULL,
                store_id        TEXT NOT NULL,
                competitor_id   TEXT,
                target_url      TEXT,
                job_type        TEXT NOT NULL,
                status          TEXT NOT NULL DEFAULT 'pending',
                batch_number    INTEGER NOT NULL DEFAULT 1,
                total_batches   INTEGER NOT NULL DEFAULT 1,
                items_processed INTEGER NOT NULL DEFAULT 0,
                items_total     INTEGER NOT NULL DEFAULT 0,
                scheduled_for   TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                started_at      TIMESTAMPTZ,
                completed_at    TIMESTAMPTZ,
                error_message   TEXT,
                created_at      TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at      TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
        """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_sj_pending
            ON scrape_job (job_type, scheduled_for)
            WHERE status = 'pending'
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS discovery_quota
            (
                store_id        TEXT NOT NULL,
                period_start    DATE NOT NULL,
                used            INTEGER NOT NULL DEFAULT 0 CHECK (used >= 0),
                limit_amount    INTEGER NOT NULL,
                updated_at      TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (store_id, period_start)
            )
        """);

        log.info("Scraper schema ready.");
    }
}
