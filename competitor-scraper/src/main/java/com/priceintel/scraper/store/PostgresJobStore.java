package com.priceintel.scraper.store;

import com.priceintel.scraper.model.ScrapeJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@Slf4j
@RequiredArgsConstructor
public class PostgresJobStore implements JobStore {

    private static final RowMapper<ScrapeJob> MAPPER = (rs, i) -> ScrapeJob.builder()
            .id(rs.getString("id"))
            .userId(rs.getString("user_id"))
            .storeId(rs.getString("store_id"))
            .competitorId(rs.getString("competitor_id"))
            .targetUrl(rs.getString("target_url"))
            .jobType(ScrapeJob.JobType.fromValue(rs.getString("job_type")))
            .status(ScrapeJob.JobStatus.fromValue(rs.getString("status")))
            .batchNumber(rs.getInt("batch_number"))
            .totalBatches(rs.getInt("total_batches"))
            .itemsProcessed(rs.getInt("items_processed"))
            .itemsTotal(rs.getInt("items_total"))
            .scheduledFor(JdbcRows.instant(rs, "scheduled_for"))
            .startedAt(JdbcRows.instant(rs, "started_at"))
            .completedAt(JdbcRows.instant(rs, "completed_at"))
            .errorMessage(rs.getString("error_message"))
            .build();

    private static final String INSERT_SQL = """
            INSERT INTO scrape_job
            (id, user_id, store_id, competitor_id, target_url, job_type, status,
             batch_number, total_batches, items_processed, items_total, scheduled_for)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public String insert(ScrapeJob job) {
        Object[] row = toRow(job);
        jdbcTemplate.update(INSERT_SQL, row);
        return (String) row[0];
    }

    @Override
    public void insertAll(List<ScrapeJob> jobs) {
        if (jobs.isEmpty()) return;
        jdbcTemplate.batchUpdate(INSERT_SQL, jobs.stream().map(this::toRow).toList());
        log.debug("Queued {} scrape jobs", jobs.size());
    }

    @Override
    public List<ScrapeJob> findDue(ScrapeJob.JobType type, Instant now, int limit) {
        return jdbcTemplate.query("""
                SELECT *
                FROM scrape_job
                WHERE job_type = ? AND status = 'pending' AND scheduled_for <= ?
                ORDER BY scheduled_for, batch_number, id
                LIMIT ?
                """, MAPPER, type.value(), JdbcRows.ts(now), limit);
    }

    @Override
    public boolean claim(String jobId, Instant now) {
        return jdbcTemplate.update("""
                UPDATE scrape_job
                SET status = 'in_progress', started_at = ?, updated_at = NOW()
                WHERE id = ? AND status = 'pending'
                """, JdbcRows.ts(now), jobId) == 1;
    }

    @Override
    public boolean finish(String jobId, ScrapeJob.JobStatus status, int itemsProcessed,
                          String errorMessage, Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return jdbcTemplate.update("""
                UPDATE scrape_job
                SET status = ?, items_processed = ?, error_message = ?, completed_at = ?, updated_at = NOW()
                WHERE id = ? AND status = 'in_progress'
                """, status.value(), itemsProcessed, errorMessage, JdbcRows.ts(now), jobId) == 1;
    }

    @Override
    public Optional<Instant> findLastCompletedAt(String userId, String storeId, ScrapeJob.JobType type) {
        Timestamp last = jdbcTemplate.queryForObject("""
                SELECT MAX(completed_at)
                FROM scrape_job
                WHERE user_id = ? AND store_id = ? AND job_type = ? AND status = 'completed'
                """, Timestamp.class, userId, storeId, type.value());
        return Optional.ofNullable(last).map(Timestamp::toInstant);
    }

    private Object[] toRow(ScrapeJob j) {
        return new Object[]{
                j.getId() != null ? j.getId() : UUID.randomUUID().toString(),
                j.getUserId(),
                j.getStoreId(),
                j.getCompetitorId(),
                j.getTargetUrl(),
                j.getJobType().value(),
                j.getStatus().value(),
                j.getBatchNumber(),
                j.getTotalBatches(),
                j.getItemsProcessed(),
                j.getItemsTotal(),
                JdbcRows.ts(j.getScheduledFor())
        };
    }
}
