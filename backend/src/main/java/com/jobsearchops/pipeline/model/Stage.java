package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Funnel position of an opportunity. Declaration order is the display order only; any stage may
 * follow any other.
 */
public enum Stage implements PersistedLabel {
    PROSPECT("Prospect"),
    WARM_LEAD("Warm Lead"),
    APPLIED("Applied"),
    RECRUITER_SCREEN("Recruiter Screen"),
    HM_INTERVIEW("HM Interview"),
    LOOP("Loop"),
    OFFER_PENDING("Offer Pending"),
    CLOSED("Closed");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    public boolean isClosed() {
        return this == CLOSED;
    }

    @JsonCreator
    public static Stage fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "stage");
    }
}
