package com.jobsearchops.pipeline.persistence;

import com.jobsearchops.pipeline.model.PipelineSummaryRow;
import com.jobsearchops.pipeline.model.ResponseStatus;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.model.TodayQueueItem;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

import static com.jobsearchops.pipeline.persistence.JdbcValues.toDate;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toLocalDate;

/**
 * Read-only projections over opportunities and contacts.
 */
@Repository
public class PipelineViewRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public PipelineViewRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<PipelineSummaryRow> pipelineSummary() {
        return jdbc.query(
            """
                SELECT stage, count, avg_fit, oldest
                FROM pipeline_summary
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> {
                Number avgFit = (Number) rs.getObject("avg_fit");
                return new PipelineSummaryRow(
                    Stage.fromLabel(rs.getString("stage")),
                    rs.getLong("count"),
                    avgFit == null ? null : avgFit.doubleValue(),
                    toLocalDate(rs.getDate("oldest"))
                );
            }
        ).stream()
            .sorted((left, right) -> left.stage().compareTo(right.stage()))
            .toList();
    }

    /**
     * Same shape as the {@code today_queue} view, evaluated for an explicit date instead of
     * {@code CURRENT_DATE}.
     */
    public List<TodayQueueItem> todayQueue(LocalDate today) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("today", toDate(today))
            .addValue("day3Origin", toDate(today.minusDays(3)))
            .addValue("day7Origin", toDate(today.minusDays(7)));
        return jdbc.query(
            """
                SELECT o.id, o.company, o.role_title, o.stage, o.tier, o.next_action, o.next_action_date,
                       c.full_name AS contact_name, c.response_status
                FROM opportunities o
                LEFT JOIN contacts c ON c.opportunity_id = o.id
                WHERE o.stage <> 'Closed'
                  AND (o.next_action_date <= :today
                       OR c.outreach_day0 = :day3Origin
                       OR c.outreach_day0 = :day7Origin)
                ORDER BY o.tier, o.next_action_date, o.id
                """,
            params,
            (rs, rowNum) -> {
                String status = rs.getString("response_status");
                return new TodayQueueItem(
                    rs.getLong("id"),
                    rs.getString("company"),
                    rs.getString("role_title"),
                    Stage.fromLabel(rs.getString("stage")),
                    rs.getObject("tier", Integer.class),
                    rs.getString("next_action"),
                    toLocalDate(rs.getDate("next_action_date")),
                    rs.getString("contact_name"),
                    status == null ? null : ResponseStatus.fromLabel(status)
                );
            }
        );
    }
}
