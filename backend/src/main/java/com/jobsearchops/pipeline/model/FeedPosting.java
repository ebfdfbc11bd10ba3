package com.jobsearchops.pipeline.model;

public record FeedPosting(String title, String link, String description) {
}
