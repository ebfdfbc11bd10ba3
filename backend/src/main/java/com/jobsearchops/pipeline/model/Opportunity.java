package com.jobsearchops.pipeline.model;

import java.time.Instant;
import java.time.LocalDate;

public record Opportunity(
    long id,
    String company,
    String roleTitle,
    JobFamily jobFamily,
    Integer tier,
    Stage stage,
    OpportunitySource source,
    LocalDate dateAdded,
    LocalDate dateApplied,
    LocalDate dateClosed,
    CloseReason closeReason,
    Integer fitScore,
    String salaryRange,
    String jdUrl,
    String jdRaw,
    String jdKeywords,
    String resumeVersion,
    String nextAction,
    LocalDate nextActionDate,
    String notes,
    String aiFitSummary,
    Instant createdAt,
    Instant updatedAt
) {
    /** {@code close_reason} is present exactly when the opportunity is closed. */
    public boolean closeReasonConsistent() {
        return (closeReason != null) == (stage != null && stage.isClosed());
    }
}
