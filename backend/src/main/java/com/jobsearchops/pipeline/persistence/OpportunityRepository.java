package com.jobsearchops.pipeline.persistence;

import com.jobsearchops.pipeline.model.CloseReason;
import com.jobsearchops.pipeline.model.JobFamily;
import com.jobsearchops.pipeline.model.NewOpportunity;
import com.jobsearchops.pipeline.model.NextAction;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.OpportunitySource;
import com.jobsearchops.pipeline.model.PersistedLabel;
import com.jobsearchops.pipeline.model.Stage;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.jobsearchops.pipeline.persistence.JdbcValues.toDate;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toInstant;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toLocalDate;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toTimestamp;

@Repository
public class OpportunityRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id, company, role_title, job_family, tier, stage, source,
               date_added, date_applied, date_closed, close_reason, fit_score,
               salary_range, jd_url, jd_raw, jd_keywords, resume_version,
               next_action, next_action_date, notes, ai_fit_summary,
               created_at, updated_at
        FROM opportunities
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<Opportunity> rowMapper = this::mapRow;

    public OpportunityRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(
        NewOpportunity opportunity,
        Stage stage,
        LocalDate dateAdded,
        NextAction nextAction,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("company", opportunity.company())
            .addValue("roleTitle", opportunity.roleTitle())
            .addValue("jobFamily", PersistedLabel.labelOf(opportunity.jobFamily()))
            .addValue("tier", opportunity.tier())
            .addValue("stage", stage.label())
            .addValue("source", PersistedLabel.labelOf(opportunity.source()))
            .addValue("dateAdded", toDate(dateAdded))
            .addValue("fitScore", opportunity.fitScore())
            .addValue("salaryRange", opportunity.salaryRange())
            .addValue("jdUrl", opportunity.jdUrl())
            .addValue("jdRaw", opportunity.jdRaw())
            .addValue("jdKeywords", opportunity.jdKeywords())
            .addValue("nextAction", nextAction == null ? null : nextAction.text())
            .addValue("nextActionDate", nextAction == null ? null : toDate(nextAction.dueDate()))
            .addValue("notes", opportunity.notes())
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO opportunities (
                    company, role_title, job_family, tier, stage, source, date_added,
                    fit_score, salary_range, jd_url, jd_raw, jd_keywords,
                    next_action, next_action_date, notes, created_at, updated_at
                )
                VALUES (
                    :company, :roleTitle, :jobFamily, :tier, :stage, :source, :dateAdded,
                    :fitScore, :salaryRange, :jdUrl, :jdRaw, :jdKeywords,
                    :nextAction, :nextActionDate, :notes, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert opportunity for " + opportunity.company());
        }
        return key.longValue();
    }

    public Opportunity findById(long id) {
        List<Opportunity> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Row-locks the opportunity for the rest of the surrounding transaction. */
    public Opportunity findByIdForUpdate(long id) {
        List<Opportunity> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id FOR UPDATE",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean existsByJdUrl(String jdUrl) {
        if (jdUrl == null) {
            return false;
        }
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM opportunities WHERE jd_url = :jdUrl",
            new MapSqlParameterSource("jdUrl", jdUrl),
            Long.class
        );
        return count != null && count > 0;
    }

    public void updateStage(
        long id,
        Stage stage,
        CloseReason closeReason,
        LocalDate dateApplied,
        LocalDate dateClosed,
        NextAction nextAction,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("stage", stage.label())
            .addValue("closeReason", PersistedLabel.labelOf(closeReason))
            .addValue("dateApplied", toDate(dateApplied))
            .addValue("dateClosed", toDate(dateClosed))
            .addValue("nextAction", nextAction == null ? null : nextAction.text())
            .addValue("nextActionDate", nextAction == null ? null : toDate(nextAction.dueDate()))
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE opportunities
                SET stage = :stage,
                    close_reason = :closeReason,
                    date_applied = :dateApplied,
                    date_closed = :dateClosed,
                    next_action = :nextAction,
                    next_action_date = :nextActionDate,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /** Open opportunities whose row has not been touched since {@code updatedBefore}. */
    public List<Opportunity> findStale(Instant updatedBefore) {
        return jdbc.query(
            SELECT_COLUMNS + """
                 WHERE stage <> 'Closed'
                   AND updated_at < :updatedBefore
                 ORDER BY updated_at, id
                """,
            new MapSqlParameterSource("updatedBefore", toTimestamp(updatedBefore)),
            rowMapper
        );
    }

    private Opportunity mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Opportunity(
            rs.getLong("id"),
            rs.getString("company"),
            rs.getString("role_title"),
            PersistedLabel.parseNullable(JobFamily.values(), rs.getString("job_family"), "job family"),
            rs.getObject("tier", Integer.class),
            Stage.fromLabel(rs.getString("stage")),
            PersistedLabel.parseNullable(OpportunitySource.values(), rs.getString("source"), "source"),
            toLocalDate(rs.getDate("date_added")),
            toLocalDate(rs.getDate("date_applied")),
            toLocalDate(rs.getDate("date_closed")),
            PersistedLabel.parseNullable(CloseReason.values(), rs.getString("close_reason"), "close reason"),
            rs.getObject("fit_score", Integer.class),
            rs.getString("salary_range"),
            rs.getString("jd_url"),
            rs.getString("jd_raw"),
            rs.getString("jd_keywords"),
            rs.getString("resume_version"),
            rs.getString("next_action"),
            toLocalDate(rs.getDate("next_action_date")),
            rs.getString("notes"),
            rs.getString("ai_fit_summary"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }
}
