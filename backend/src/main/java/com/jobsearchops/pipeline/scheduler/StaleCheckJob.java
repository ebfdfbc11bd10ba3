package com.jobsearchops.pipeline.scheduler;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.external.PipelineNotifier;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.StaleReport;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import com.jobsearchops.pipeline.service.FollowUpService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only pass that reports contacts still waiting on a reply and open opportunities nobody has
 * touched in a while.
 */
@Component
@Order(1)
public class StaleCheckJob implements DailyJob {
    private static final Logger log = LoggerFactory.getLogger(StaleCheckJob.class);

    private final FollowUpService followUpService;
    private final OpportunityRepository opportunities;
    private final PipelineNotifier notifier;
    private final PipelineProperties properties;
    private final Clock clock;

    public StaleCheckJob(
        FollowUpService followUpService,
        OpportunityRepository opportunities,
        PipelineNotifier notifier,
        PipelineProperties properties,
        Clock clock
    ) {
        this.followUpService = followUpService;
        this.opportunities = opportunities;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "stale-check";
    }

    @Override
    public void run(LocalDate runDate) {
        List<Contact> waitingOn = followUpService.staleWaitingOn();
        Duration staleAfter = Duration.ofDays(properties.getFollowUp().getStaleOpportunityDays());
        List<Opportunity> stale = opportunities.findStale(clock.instant().minus(staleAfter));
        StaleReport report = new StaleReport(runDate, waitingOn, stale);
        if (report.isEmpty()) {
            log.info("Stale check {}: nothing waiting", runDate);
            return;
        }
        notifier.staleRecordsFound(report);
    }
}
