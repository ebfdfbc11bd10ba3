package com.jobsearchops.pipeline.scheduler;

import java.time.LocalDate;

/**
 * One step of the daily sequence. Throwing marks the step failed; the scheduler logs it and moves
 * on to the next step.
 */
public interface DailyJob {
    String name();

    void run(LocalDate runDate);
}
