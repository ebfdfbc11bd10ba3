package com.jobsearchops.pipeline.model;

public record NewOpportunity(
    String company,
    String roleTitle,
    JobFamily jobFamily,
    Integer tier,
    OpportunitySource source,
    Integer fitScore,
    String salaryRange,
    String jdUrl,
    String jdRaw,
    String jdKeywords,
    String notes
) {
}
