package com.jobsearchops.pipeline.model;

import java.time.Instant;

public record ActivityLogEntry(
    long id,
    Long opportunityId,
    Long contactId,
    ActivityType activityType,
    String description,
    String metadata,
    Instant createdAt
) {
}
