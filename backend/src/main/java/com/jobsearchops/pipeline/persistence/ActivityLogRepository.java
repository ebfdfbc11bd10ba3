package com.jobsearchops.pipeline.persistence;

import com.jobsearchops.pipeline.model.ActivityLogEntry;
import com.jobsearchops.pipeline.model.ActivityType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

import static com.jobsearchops.pipeline.persistence.JdbcValues.toInstant;
import static com.jobsearchops.pipeline.persistence.JdbcValues.toTimestamp;

/**
 * The activity ledger is append-only: this repository exposes inserts and reads, nothing that
 * rewrites or removes a row.
 */
@Repository
public class ActivityLogRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public ActivityLogRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(
        Long opportunityId,
        Long contactId,
        ActivityType type,
        String description,
        String metadata,
        Instant createdAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("contactId", contactId)
            .addValue("activityType", type.label())
            .addValue("description", description)
            .addValue("metadata", metadata)
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO activity_log (
                    opportunity_id, contact_id, activity_type, description, metadata, created_at
                )
                VALUES (:opportunityId, :contactId, :activityType, :description, :metadata, :createdAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to append activity " + type.label());
        }
        return key.longValue();
    }

    /**
     * Most recent entries first, optionally narrowed to one opportunity.
     */
    public List<ActivityLogEntry> findRecent(Long opportunityId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("opportunityId", opportunityId)
            .addValue("limit", Math.max(1, limit));
        String filter = opportunityId == null ? "" : " WHERE opportunity_id = :opportunityId";
        return jdbc.query(
            "SELECT id, opportunity_id, contact_id, activity_type, description, metadata, created_at"
                + " FROM activity_log" + filter
                + " ORDER BY created_at DESC, id DESC LIMIT :limit",
            params,
            (rs, rowNum) -> new ActivityLogEntry(
                rs.getLong("id"),
                rs.getObject("opportunity_id", Long.class),
                rs.getObject("contact_id", Long.class),
                ActivityType.fromLabel(rs.getString("activity_type")),
                rs.getString("description"),
                rs.getString("metadata"),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }
}
