package com.jobsearchops.pipeline.model;

public enum TickOutcome {
    /** Wall clock has not reached today's run time. */
    NOT_YET_DUE,
    /** Today's run was already claimed, by this process or an earlier one. */
    ALREADY_RAN,
    RAN
}
