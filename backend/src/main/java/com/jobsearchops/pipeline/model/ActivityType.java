package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType implements PersistedLabel {
    STAGE_CHANGE("Stage Change"),
    OUTREACH_SENT("Outreach Sent"),
    FOLLOW_UP_SENT("Follow-Up Sent"),
    RESPONSE_RECEIVED("Response Received"),
    CALL_COMPLETED("Call Completed"),
    APPLICATION_SUBMITTED("Application Submitted"),
    INTERVIEW_SCHEDULED("Interview Scheduled"),
    INTERVIEW_COMPLETED("Interview Completed"),
    OFFER_RECEIVED("Offer Received"),
    AI_ACTION("AI Action"),
    NOTE_ADDED("Note Added");

    private final String label;

    ActivityType(String label) {
        this.label = label;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ActivityType fromLabel(String raw) {
        return PersistedLabel.parse(values(), raw, "activity type");
    }
}
