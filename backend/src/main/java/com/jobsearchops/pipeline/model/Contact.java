package com.jobsearchops.pipeline.model;

import java.time.Instant;
import java.time.LocalDate;

public record Contact(
    long id,
    Long opportunityId,
    String fullName,
    String title,
    String company,
    String linkedinUrl,
    String email,
    ContactType contactType,
    LocalDate outreachDay0,
    LocalDate outreachDay3,
    LocalDate outreachDay7,
    ResponseStatus responseStatus,
    boolean callCompleted,
    boolean referralAsked,
    boolean referralGiven,
    String notes,
    Instant createdAt,
    Instant updatedAt
) {
    public LocalDate cadenceDate(CadenceStep step) {
        return switch (step) {
            case DAY0 -> outreachDay0;
            case DAY3 -> outreachDay3;
            case DAY7 -> outreachDay7;
        };
    }

    /** Each recorded step has its predecessor recorded on the same day or earlier. */
    public boolean cadenceOrdered() {
        for (CadenceStep step : CadenceStep.values()) {
            LocalDate date = cadenceDate(step);
            CadenceStep previous = step.previous();
            if (date == null || previous == null) {
                continue;
            }
            LocalDate previousDate = cadenceDate(previous);
            if (previousDate == null || previousDate.isAfter(date)) {
                return false;
            }
        }
        return true;
    }
}
