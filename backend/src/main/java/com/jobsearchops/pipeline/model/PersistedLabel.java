package com.jobsearchops.pipeline.model;

import com.jobsearchops.pipeline.exception.ValidationException;

/**
 * Closed enumerations stored as their display label (e.g. {@code "Warm Lead"}) in the database.
 */
public interface PersistedLabel {

    String label();

    static <E extends Enum<E> & PersistedLabel> E parse(E[] values, String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        String value = raw.trim();
        for (E candidate : values) {
            if (candidate.label().equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new ValidationException("Unknown " + field + ": " + raw);
    }

    static <E extends Enum<E> & PersistedLabel> E parseNullable(E[] values, String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return parse(values, raw, field);
    }

    static String labelOf(PersistedLabel value) {
        return value == null ? null : value.label();
    }
}
