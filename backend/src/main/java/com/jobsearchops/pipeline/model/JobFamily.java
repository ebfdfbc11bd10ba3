package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobFamily implements PersistedLabel {
    A("Analytics Manager"),
    B("Data Manager"),
    C("BI Manager"),
    D("Decision Science"),
    E("Director Stretch");

    private final String description;

    JobFamily(String description) {
        this.description = description;
    }

    @Override
    @JsonValue
    public String label() {
        return name();
    }

    public String description() {
        return description;
    }

    @JsonCreator
    public static JobFamily fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "job family");
    }
}
