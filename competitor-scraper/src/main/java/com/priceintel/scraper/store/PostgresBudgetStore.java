package com.priceintel.scraper.store;

import com.priceintel.scraper.model.ScrapeBudget;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PostgresBudgetStore implements BudgetStore {

    private static final String COLUMNS = "user_id, daily_used, daily_date, monthly_used, month_period_start";

    private static final RowMapper<ScrapeBudget> MAPPER = (rs, i) -> ScrapeBudget.builder()
            .userId(rs.getString("user_id"))
            .dailyUsed(rs.getInt("daily_used"))
            .dailyDate(JdbcRows.localDate(rs, "daily_date"))
            .monthlyUsed(rs.getInt("monthly_used"))
            .monthPeriodStart(JdbcRows.localDate(rs, "month_period_start"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<ScrapeBudget> find(String userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM scrape_budget WHERE user_id = ?", MAPPER, userId)
                .stream()
                .findFirst();
    }

    @Override
    public void createIfAbsent(String userId, LocalDate today, LocalDate monthStart) {
        jdbcTemplate.update("""
                INSERT INTO scrape_budget (user_id, daily_used, daily_date, monthly_used, month_period_start)
                VALUES (?, 0, ?, 0, ?)
                ON CONFLICT (user_id) DO NOTHING
                """, userId, JdbcRows.date(today), JdbcRows.date(monthStart));
    }

    @Override
    public void resetDaily(String userId, LocalDate today) {
        jdbcTemplate.update("""
                UPDATE scrape_budget
                SET daily_used = 0, daily_date = ?, updated_at = NOW()
                WHERE user_id = ? AND daily_date <> ?
                """, JdbcRows.date(today), userId, JdbcRows.date(today));
    }

    @Override
    public void resetMonthly(String userId, LocalDate monthStart) {
        jdbcTemplate.update("""
                UPDATE scrape_budget
                SET monthly_used = 0, month_period_start = ?, updated_at = NOW()
                WHERE user_id = ? AND month_period_start < ?
                """, JdbcRows.date(monthStart), userId, JdbcRows.date(monthStart));
    }

    @Override
    public Optional<ScrapeBudget> increment(String userId, int cost) {
        return jdbcTemplate.query("""
                UPDATE scrape_budget
                SET daily_used = daily_used + ?, monthly_used = monthly_used + ?, updated_at = NOW()
                WHERE user_id = ?
                RETURNING """ + " " + COLUMNS, MAPPER, cost, cost, userId)
                .stream()
                .findFirst();
    }
}
