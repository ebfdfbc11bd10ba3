package com.jobsearchops.pipeline.model;

import java.time.LocalDate;
import java.util.List;

public record DigestContext(
    LocalDate date,
    List<TodayQueueItem> todayQueue,
    List<DueFollowUp> dueFollowUps,
    List<PipelineSummaryRow> pipelineSummary
) {
    public boolean isEmpty() {
        return todayQueue.isEmpty() && dueFollowUps.isEmpty() && pipelineSummary.isEmpty();
    }
}
