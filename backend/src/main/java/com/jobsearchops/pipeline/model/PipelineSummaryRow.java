package com.jobsearchops.pipeline.model;

import java.time.LocalDate;

public record PipelineSummaryRow(Stage stage, long count, Double averageFitScore, LocalDate oldestDateAdded) {
}
