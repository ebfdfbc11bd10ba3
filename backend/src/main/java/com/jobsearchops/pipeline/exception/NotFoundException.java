package com.jobsearchops.pipeline.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException opportunity(long opportunityId) {
        return new NotFoundException("Opportunity " + opportunityId + " not found");
    }

    public static NotFoundException contact(long contactId) {
        return new NotFoundException("Contact " + contactId + " not found");
    }
}
