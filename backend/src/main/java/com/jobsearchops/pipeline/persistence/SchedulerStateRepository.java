package com.jobsearchops.pipeline.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.jobsearchops.pipeline.persistence.JdbcValues.toDate;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toLocalDate;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toTimestamp;

/**
 * Single-row watermark (id = 1) holding the last day the daily jobs were claimed.
 */
@Repository
public class SchedulerStateRepository {
    private static final int STATE_ROW_ID = 1;

    private final NamedParameterJdbcTemplate jdbc;

    public SchedulerStateRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public LocalDate findLastRunDate() {
        List<LocalDate> rows = jdbc.query(
            "SELECT last_run_date FROM scheduler_state WHERE id = :id",
            new MapSqlParameterSource("id", STATE_ROW_ID),
            (rs, rowNum) -> toLocalDate(rs.getDate("last_run_date"))
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Conditionally advances the watermark to {@code today}. The compare and the write are one
     * statement, so of two processes racing on the same day exactly one gets {@code true}.
     */
    public boolean claimRunDate(LocalDate today, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", STATE_ROW_ID)
            .addValue("today", toDate(today))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE scheduler_state
                SET last_run_date = :today,
                    updated_at = :now
                WHERE id = :id
                  AND (last_run_date IS NULL OR last_run_date < :today)
                """,
            params
        );
        return updated == 1;
    }
}
