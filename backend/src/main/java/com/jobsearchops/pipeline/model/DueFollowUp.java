package com.jobsearchops.pipeline.model;

import java.time.LocalDate;

public record DueFollowUp(Contact contact, CadenceStep step, LocalDate dueSince) {
}
