package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CloseReason implements PersistedLabel {
    ACCEPTED("Accepted"),
    DECLINED("Declined"),
    REJECTED("Rejected"),
    GHOSTED("Ghosted"),
    WITHDREW("Withdrew");

    private final String label;

    CloseReason(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static CloseReason fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "close reason");
    }
}
