package com.jobsearchops.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outreach touchpoints for a contact. Day 3 and day 7 are counted from day 0, never from the
 * previous step.
 */
public enum CadenceStep implements PersistedLabel {
    DAY0("Day 0", 0, ActivityType.OUTREACH_SENT),
    DAY3("Day 3", 3, ActivityType.FOLLOW_UP_SENT),
    DAY7("Day 7", 7, ActivityType.FOLLOW_UP_SENT);

    private final String label;
    private final int daysAfterFirstOutreach;
    private final ActivityType activityType;

    CadenceStep(String label, int daysAfterFirstOutreach, ActivityType activityType) {
        this.label = label;
        this.daysAfterFirstOutreach = daysAfterFirstOutreach;
        this.activityType = activityType;
    }

    @Override
    @JsonValue
    public String label() {
        return label;
    }

    public int daysAfterFirstOutreach() {
        return daysAfterFirstOutreach;
    }

    public ActivityType activityType() {
        return activityType;
    }

    /** The step that must already be recorded before this one, or {@code null} for day 0. */
    public CadenceStep previous() {
        return switch (this) {
            case DAY0 -> null;
            case DAY3 -> DAY0;
            case DAY7 -> DAY3;
        };
    }

    @JsonCreator
    public static CadenceStep fromLabel(String raw) {
        if (raw != null) {
            String compact = raw.trim().replace(" ", "").replace("-", "");
            for (CadenceStep step : values()) {
                if (step.name().equalsIgnoreCase(compact)) {
                    return step;
                }
            }
        }
        return PersistedLabel.parse(values(), raw, "cadence step");
    }
}
