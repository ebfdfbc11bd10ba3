package com.jobsearchops.pipeline.external;

import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.StaleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

public class LoggingPipelineNotifier implements PipelineNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineNotifier.class);

    @Override
    public void staleRecordsFound(StaleReport report) {
        log.warn(
            "Stale check {}: {} contacts waiting on a reply, {} opportunities untouched",
            report.asOf(),
            report.waitingOn().size(),
            report.staleOpportunities().size()
        );
        for (Contact contact : report.waitingOn()) {
            log.warn("  waiting on {} ({}) since {}", contact.fullName(), contact.company(), contact.outreachDay0());
        }
        for (Opportunity opportunity : report.staleOpportunities()) {
            log.warn(
                "  stale opportunity {} {} / {} stage={} updatedAt={}",
                opportunity.id(),
                opportunity.company(),
                opportunity.roleTitle(),
                opportunity.stage().label(),
                opportunity.updatedAt()
            );
        }
    }

    @Override
    public void digestReady(LocalDate date, String digest) {
        log.info("Daily digest for {}:\n{}", date, digest);
    }
}
