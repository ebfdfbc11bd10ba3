package com.jobsearchops.pipeline.persistence;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

final class JdbcValues {
    private JdbcValues() {
    }

    static Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    static LocalDate toLocalDate(Date value) {
        return value == null ? null : value.toLocalDate();
    }

    static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
