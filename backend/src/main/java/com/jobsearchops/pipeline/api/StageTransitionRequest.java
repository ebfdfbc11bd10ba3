package com.jobsearchops.pipeline.api;

public record StageTransitionRequest(String stage, String closeReason, String note) {
}
