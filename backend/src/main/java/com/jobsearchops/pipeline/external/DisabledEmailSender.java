package com.jobsearchops.pipeline.external;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sender when no mail transport is configured. Every send reports failure.
 */
public class DisabledEmailSender implements EmailSender {
    private static final Logger log = LoggerFactory.getLogger(DisabledEmailSender.class);

    @Override
    public boolean send(String to, String subject, String body) {
        log.warn("Email sending is not configured; dropped message to={} subject={}", to, subject);
        return false;
    }
}
