package com.jobsearchops.pipeline.api;

public record CreateOpportunityRequest(
    String company,
    String roleTitle,
    String jobFamily,
    Integer tier,
    String source,
    Integer fitScore,
    String salaryRange,
    String jdUrl,
    String jdRaw,
    String notes
) {
}
