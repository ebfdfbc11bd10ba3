package com.jobsearchops.pipeline.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String errorKey() {
        if (errorCode != null) {
            return errorCode;
        }
        if (statusCode > 0) {
            return "http_" + statusCode;
        }
        return "unknown_error";
    }
}
