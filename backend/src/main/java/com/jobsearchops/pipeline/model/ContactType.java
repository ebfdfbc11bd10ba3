package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContactType implements PersistedLabel {
    HIRING_MANAGER("Hiring Manager"),
    PEER("Peer"),
    RECRUITER("Recruiter"),
    ALUMNI("Alumni"),
    REFERRAL_SOURCE("Referral Source"),
    OTHER("Other");

    private final String label;

    ContactType(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ContactType fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "contact type");
    }
}
