package com.jobsearchops.pipeline.model;

import java.util.List;

/**
 * Outcome of one poll across all feed sources. {@code skipped} counts postings dropped by the
 * keyword filter plus postings whose URL was already ingested.
 */
public record FeedPollResult(
    int created,
    int skipped,
    List<FeedSourceError> errors,
    List<String> createdTitles
) {
}
