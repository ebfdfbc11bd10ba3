package com.jobsearchops.pipeline.model;

import java.time.LocalDate;

public record TodayQueueItem(
    long opportunityId,
    String company,
    String roleTitle,
    Stage stage,
    Integer tier,
    String nextAction,
    LocalDate nextActionDate,
    String contactName,
    ResponseStatus responseStatus
) {
}
