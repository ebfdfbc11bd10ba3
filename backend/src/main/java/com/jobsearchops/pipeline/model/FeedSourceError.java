package com.jobsearchops.pipeline.model;

public record FeedSourceError(String source, String error) {
}
