package com.jobsearchops.pipeline.exception;

/**
 * Raised by guard checks that the mutation contracts make unreachable, e.g. a cadence write that
 * would record day 7 before day 3. Seeing one means a logic bug, not bad input.
 */
public class ConsistencyViolationException extends IllegalStateException {
    public ConsistencyViolationException(String message) {
        super(message);
    }
}
