package com.jobsearchops.pipeline.model;

import java.time.LocalDate;

public record NextAction(String text, LocalDate dueDate) {
}
