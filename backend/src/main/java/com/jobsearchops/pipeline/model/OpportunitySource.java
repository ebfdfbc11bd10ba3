package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OpportunitySource implements PersistedLabel {
    LINKEDIN("LinkedIn"),
    REFERRAL("Referral"),
    JOB_BOARD("Job Board"),
    OUTBOUND("Outbound"),
    OTHER("Other");

    private final String label;

    OpportunitySource(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static OpportunitySource fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "source");
    }
}
