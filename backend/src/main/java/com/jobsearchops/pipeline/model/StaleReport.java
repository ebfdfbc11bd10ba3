package com.jobsearchops.pipeline.model;

import java.time.LocalDate;
import java.util.List;

public record StaleReport(LocalDate asOf, List<Contact> waitingOn, List<Opportunity> staleOpportunities) {
    public boolean isEmpty() {
        return waitingOn.isEmpty() && staleOpportunities.isEmpty();
    }
}
