package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.NewOpportunity;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@Service
public class OpportunityService {
    private static final Logger log = LoggerFactory.getLogger(OpportunityService.class);

    private final OpportunityRepository opportunities;
    private final ActivityLedger ledger;
    private final Clock clock;

    public OpportunityService(OpportunityRepository opportunities, ActivityLedger ledger, Clock clock) {
        this.opportunities = opportunities;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Transactional
    public Opportunity create(NewOpportunity request) {
        return create(request, null, null);
    }

    /**
     * Creates an opportunity as a Prospect with the Prospect next action and records a
     * {@code Note Added} entry. Feed ingestion passes its own note and source metadata.
     */
    @Transactional
    public Opportunity create(NewOpportunity request, String ledgerNote, Map<String, ?> ledgerMetadata) {
        validate(request);
        LocalDate today = LocalDate.now(clock);
        long id = opportunities.insert(
            request,
            Stage.PROSPECT,
            today,
            NextActionPolicy.nextActionFor(Stage.PROSPECT, today),
            clock.instant()
        );
        String description = ledgerNote == null || ledgerNote.isBlank()
            ? "Opportunity created: " + request.company() + " / " + request.roleTitle()
            : ledgerNote;
        ledger.append(
            id,
            null,
            ActivityType.NOTE_ADDED,
            description,
            ledgerMetadata
        );
        log.info("Created opportunity {} company={} role={}", id, request.company(), request.roleTitle());
        return opportunities.findById(id);
    }

    public Opportunity get(long opportunityId) {
        Opportunity opportunity = opportunities.findById(opportunityId);
        if (opportunity == null) {
            throw NotFoundException.opportunity(opportunityId);
        }
        return opportunity;
    }

    private void validate(NewOpportunity request) {
        if (request == null) {
            throw new ValidationException("opportunity is required");
        }
        if (request.company() == null || request.company().isBlank()) {
            throw new ValidationException("company is required");
        }
        if (request.roleTitle() == null || request.roleTitle().isBlank()) {
            throw new ValidationException("role_title is required");
        }
        if (request.tier() != null && (request.tier() < 1 || request.tier() > 3)) {
            throw new ValidationException("tier must be between 1 and 3");
        }
        if (request.fitScore() != null && (request.fitScore() < 1 || request.fitScore() > 10)) {
            throw new ValidationException("fit_score must be between 1 and 10");
        }
    }
}
