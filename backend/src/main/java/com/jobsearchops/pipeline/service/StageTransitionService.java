package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.ConsistencyViolationException;
import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.CloseReason;
import com.jobsearchops.pipeline.model.NextAction;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.PersistedLabel;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves opportunities between stages. Any stage may follow any other so mistakes can be undone;
 * the only hard rule is that closing needs a reason.
 */
@Service
public class StageTransitionService {
    private static final Logger log = LoggerFactory.getLogger(StageTransitionService.class);

    private final OpportunityRepository opportunities;
    private final ActivityLedger ledger;
    private final Clock clock;

    public StageTransitionService(OpportunityRepository opportunities, ActivityLedger ledger, Clock clock) {
        this.opportunities = opportunities;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Transactional
    public Opportunity transition(long opportunityId, Stage target) {
        return transition(opportunityId, target, null, null);
    }

    /**
     * Applies the stage change, its side dates, the recomputed next action and the ledger entry as
     * one unit.
     *
     * @param closeReason required when {@code target} is {@link Stage#CLOSED}, ignored otherwise
     * @param note optional free text appended to the ledger description
     */
    @Transactional
    public Opportunity transition(long opportunityId, Stage target, CloseReason closeReason, String note) {
        if (target == null) {
            throw new ValidationException("stage is required");
        }
        if (target.isClosed() && closeReason == null) {
            throw new ValidationException("close_reason is required when moving to Closed");
        }
        Opportunity current = opportunities.findByIdForUpdate(opportunityId);
        if (current == null) {
            throw NotFoundException.opportunity(opportunityId);
        }

        LocalDate today = LocalDate.now(clock);
        Instant now = clock.instant();
        CloseReason reason = target.isClosed() ? closeReason : null;
        LocalDate dateApplied = current.dateApplied();
        if (target == Stage.APPLIED && dateApplied == null) {
            dateApplied = today;
        }
        LocalDate dateClosed = target.isClosed() ? today : null;
        NextAction nextAction = NextActionPolicy.nextActionFor(target, today);
        if ((reason != null) != target.isClosed()) {
            throw new ConsistencyViolationException(
                "close_reason/stage mismatch for opportunity " + opportunityId + " target=" + target.label()
            );
        }

        opportunities.updateStage(opportunityId, target, reason, dateApplied, dateClosed, nextAction, now);

        Stage previous = current.stage();
        String description = "Stage: " + previous.label() + " → " + target.label();
        if (note != null && !note.isBlank()) {
            description = description + ". " + note.trim();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", previous.label());
        metadata.put("to", target.label());
        if (reason != null) {
            metadata.put("close_reason", reason.label());
        }
        ledger.append(opportunityId, null, ActivityType.STAGE_CHANGE, description, metadata);

        log.info(
            "Opportunity {} moved {} -> {} closeReason={}",
            opportunityId,
            previous.label(),
            target.label(),
            PersistedLabel.labelOf(reason)
        );
        return opportunities.findById(opportunityId);
    }
}
