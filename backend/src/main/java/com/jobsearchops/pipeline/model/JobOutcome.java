package com.jobsearchops.pipeline.model;

import java.time.Duration;

public record JobOutcome(String job, boolean succeeded, String error, Duration duration) {
}
