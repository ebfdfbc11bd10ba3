package com.jobsearchops.pipeline.api;

public record ResponseStatusRequest(String status) {
}
