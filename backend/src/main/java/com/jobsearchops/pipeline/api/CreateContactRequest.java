package com.jobsearchops.pipeline.api;

public record CreateContactRequest(
    Long opportunityId,
    String fullName,
    String title,
    String company,
    String linkedinUrl,
    String email,
    String contactType,
    String notes
) {
}
