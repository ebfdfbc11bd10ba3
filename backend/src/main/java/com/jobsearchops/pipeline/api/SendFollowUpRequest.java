package com.jobsearchops.pipeline.api;

public record SendFollowUpRequest(String subject, String body) {
}
