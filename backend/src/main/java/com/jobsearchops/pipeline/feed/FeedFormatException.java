package com.jobsearchops.pipeline.feed;

/**
 * The fetched document is not an RSS or Atom feed.
 */
public class FeedFormatException extends RuntimeException {
    public FeedFormatException(String message) {
        super(message);
    }
}
