package com.jobsearchops.pipeline.model;

public record NewContact(
    Long opportunityId,
    String fullName,
    String title,
    String company,
    String linkedinUrl,
    String email,
    ContactType contactType,
    String notes
) {
}
