package com.jobsearchops.pipeline.model;

import java.time.LocalDate;
import java.time.LocalTime;

public record SchedulerStatus(
    boolean running,
    LocalTime runTime,
    LocalDate lastRunDate,
    DailyRunSummary lastRun
) {
}
