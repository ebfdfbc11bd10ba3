package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseStatus implements PersistedLabel {
    PENDING("Pending"),
    RESPONDED("Responded"),
    NO_RESPONSE("No Response"),
    MEETING_SCHEDULED("Meeting Scheduled");

    private final String label;

    ResponseStatus(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    /** Only contacts that have not answered yet get follow-ups. */
    public boolean awaitingReply() {
        return this == PENDING || this == NO_RESPONSE;
    }

    @JsonCreator
    public static ResponseStatus fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "response status");
    }
}
