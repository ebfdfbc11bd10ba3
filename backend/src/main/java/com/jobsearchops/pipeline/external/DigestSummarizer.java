package com.jobsearchops.pipeline.external;

import com.jobsearchops.pipeline.model.DigestContext;

/**
 * Turns the day's pipeline data into digest text. Implementations may be slow or fail; callers
 * bound the wait.
 */
public interface DigestSummarizer {
    String summarize(DigestContext context);
}
