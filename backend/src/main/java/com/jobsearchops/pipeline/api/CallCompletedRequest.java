package com.jobsearchops.pipeline.api;

public record CallCompletedRequest(Boolean referralAsked, Boolean referralGiven, String note) {
}
