package com.jobsearchops.pipeline.persistence;

import com.jobsearchops.pipeline.model.CadenceStep;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.ContactType;
import com.jobsearchops.pipeline.model.NewContact;
import com.jobsearchops.pipeline.model.PersistedLabel;
import com.jobsearchops.pipeline.model.ResponseStatus;
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
public class ContactRepository {
    private static final String SELECT_COLUMNS = """
        SELECT id, opportunity_id, full_name, title, company, linkedin_url, email,
               contact_type, outreach_day0, outreach_day3, outreach_day7, response_status,
               call_completed, referral_asked, referral_given, notes, created_at, updated_at
        FROM contacts
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<Contact> rowMapper = this::mapRow;

    public ContactRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(NewContact contact, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("opportunityId", contact.opportunityId())
            .addValue("fullName", contact.fullName())
            .addValue("title", contact.title())
            .addValue("company", contact.company())
            .addValue("linkedinUrl", contact.linkedinUrl())
            .addValue("email", contact.email())
            .addValue("contactType", PersistedLabel.labelOf(contact.contactType()))
            .addValue("responseStatus", ResponseStatus.PENDING.label())
            .addValue("notes", contact.notes())
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO contacts (
                    opportunity_id, full_name, title, company, linkedin_url, email,
                    contact_type, response_status, notes, created_at, updated_at
                )
                VALUES (
                    :opportunityId, :fullName, :title, :company, :linkedinUrl, :email,
                    :contactType, :responseStatus, :notes, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert contact " + contact.fullName());
        }
        return key.longValue();
    }

    public Contact findById(long id) {
        List<Contact> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Contact findByIdForUpdate(long id) {
        List<Contact> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id FOR UPDATE",
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /** Contacts mid-cadence that have not replied: day 0 sent, day 7 not yet sent. */
    public List<Contact> findCadenceCandidates() {
        return jdbc.query(
            SELECT_COLUMNS + """
                 WHERE outreach_day0 IS NOT NULL
                   AND outreach_day7 IS NULL
                   AND response_status IN ('Pending', 'No Response')
                 ORDER BY outreach_day0, id
                """,
            new MapSqlParameterSource(),
            rowMapper
        );
    }

    /** Pending contacts whose first outreach went out on or before {@code sentOnOrBefore}. */
    public List<Contact> findWaitingOn(LocalDate sentOnOrBefore) {
        return jdbc.query(
            SELECT_COLUMNS + """
                 WHERE response_status = 'Pending'
                   AND outreach_day0 IS NOT NULL
                   AND outreach_day0 <= :cutoff
                 ORDER BY outreach_day0, id
                """,
            new MapSqlParameterSource("cutoff", toDate(sentOnOrBefore)),
            rowMapper
        );
    }

    /**
     * Records a cadence step date. Only writes while the column is still empty, so a second call
     * for the same step changes nothing and returns {@code false}. Recording day 0 restarts the
     * reply tracking at {@code Pending}.
     */
    public boolean updateCadenceDate(long id, CadenceStep step, LocalDate sentOn, Instant now) {
        String column = switch (step) {
            case DAY0 -> "outreach_day0";
            case DAY3 -> "outreach_day3";
            case DAY7 -> "outreach_day7";
        };
        String statusReset = step == CadenceStep.DAY0 ? ", response_status = 'Pending'" : "";
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("sentOn", toDate(sentOn))
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            "UPDATE contacts SET " + column + " = :sentOn" + statusReset + ", updated_at = :now"
                + " WHERE id = :id AND " + column + " IS NULL",
            params
        );
        return updated == 1;
    }

    public void updateResponseStatus(long id, ResponseStatus status, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", status.label())
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE contacts
                SET response_status = :status,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void markCallCompleted(long id, boolean referralAsked, boolean referralGiven, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("referralAsked", referralAsked)
            .addValue("referralGiven", referralGiven)
            .addValue("now", toTimestamp(now));
        jdbc.update(
            """
                UPDATE contacts
                SET call_completed = TRUE,
                    referral_asked = referral_asked OR :referralAsked,
                    referral_given = referral_given OR :referralGiven,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    private Contact mapRow(ResultSet rs, int rowNum) throws SQLException {
        String status = rs.getString("response_status");
        return new Contact(
            rs.getLong("id"),
            rs.getObject("opportunity_id", Long.class),
            rs.getString("full_name"),
            rs.getString("title"),
            rs.getString("company"),
            rs.getString("linkedin_url"),
            rs.getString("email"),
            PersistedLabel.parseNullable(ContactType.values(), rs.getString("contact_type"), "contact type"),
            toLocalDate(rs.getDate("outreach_day0")),
            toLocalDate(rs.getDate("outreach_day3")),
            toLocalDate(rs.getDate("outreach_day7")),
            status == null ? ResponseStatus.PENDING : ResponseStatus.fromLabel(status),
            rs.getBoolean("call_completed"),
            rs.getBoolean("referral_asked"),
            rs.getBoolean("referral_given"),
            rs.getString("notes"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }
}
