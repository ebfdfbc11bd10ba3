package com.jobsearchops.pipeline.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record DailyRunSummary(LocalDate runDate, Instant startedAt, Instant finishedAt, List<JobOutcome> jobs) {
    public long failedCount() {
        return jobs.stream().filter(job -> !job.succeeded()).count();
    }
}
