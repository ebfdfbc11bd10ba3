package com.jobsearchops.pipeline.exception;

/**
 * A network or collaborator failure (feed fetch, summarizer call, email send). Never retried in a
 * loop; the next scheduled tick is the retry.
 */
public class TransientIoException extends RuntimeException {
    private final String errorCode;

    public TransientIoException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TransientIoException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
