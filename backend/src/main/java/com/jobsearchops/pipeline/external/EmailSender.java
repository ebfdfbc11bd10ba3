package com.jobsearchops.pipeline.external;

public interface EmailSender {
    /**
     * @return {@code true} only when the message was handed off successfully
     */
    boolean send(String to, String subject, String body);
}
