package com.jobsearchops.pipeline.external;

import com.jobsearchops.pipeline.model.StaleReport;

import java.time.LocalDate;

public interface PipelineNotifier {
    void staleRecordsFound(StaleReport report);

    void digestReady(LocalDate date, String digest);
}
