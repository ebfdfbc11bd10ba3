package com.jobsearchops.pipeline.service;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.exception.ConsistencyViolationException;
import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.CadenceStep;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.DueFollowUp;
import com.jobsearchops.pipeline.persistence.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tracks the day 0 / day 3 / day 7 outreach cadence. Due dates are always counted from day 0 so a
 * late day 3 does not push day 7 back.
 */
@Service
public class FollowUpService {
    private static final Logger log = LoggerFactory.getLogger(FollowUpService.class);

    private final ContactRepository contacts;
    private final ActivityLedger ledger;
    private final PipelineProperties properties;
    private final Clock clock;

    public FollowUpService(
        ContactRepository contacts,
        ActivityLedger ledger,
        PipelineProperties properties,
        Clock clock
    ) {
        this.contacts = contacts;
        this.ledger = ledger;
        this.properties = properties;
        this.clock = clock;
    }

    public List<DueFollowUp> dueFollowUps() {
        LocalDate today = LocalDate.now(clock);
        List<DueFollowUp> due = new ArrayList<>();
        for (Contact contact : contacts.findCadenceCandidates()) {
            DueFollowUp next = nextDue(contact, today);
            if (next != null) {
                due.add(next);
            }
        }
        return due;
    }

    /**
     * The single follow-up step {@code contact} is due for on {@code today}, or {@code null}.
     */
    static DueFollowUp nextDue(Contact contact, LocalDate today) {
        LocalDate day0 = contact.outreachDay0();
        if (day0 == null || contact.outreachDay7() != null || !contact.responseStatus().awaitingReply()) {
            return null;
        }
        CadenceStep step = contact.outreachDay3() == null ? CadenceStep.DAY3 : CadenceStep.DAY7;
        LocalDate dueDate = day0.plusDays(step.daysAfterFirstOutreach());
        if (today.isBefore(dueDate)) {
            return null;
        }
        return new DueFollowUp(contact, step, dueDate);
    }

    /**
     * Records that {@code step} went out today. A step that is already recorded is left as it is
     * and nothing is logged.
     *
     * @throws ValidationException when the preceding step has not been sent yet
     */
    @Transactional
    public Contact markSent(long contactId, CadenceStep step) {
        if (step == null) {
            throw new ValidationException("cadence step is required");
        }
        Contact contact = contacts.findByIdForUpdate(contactId);
        if (contact == null) {
            throw NotFoundException.contact(contactId);
        }
        if (contact.cadenceDate(step) != null) {
            log.debug("Contact {} already has {} recorded on {}", contactId, step.label(), contact.cadenceDate(step));
            return contact;
        }
        requirePredecessorSent(contact, step);

        LocalDate today = LocalDate.now(clock);
        CadenceStep previous = step.previous();
        if (previous != null && contact.cadenceDate(previous).isAfter(today)) {
            throw new ConsistencyViolationException(
                "Contact " + contactId + " has " + previous.label() + " after " + today
            );
        }
        if (!contacts.updateCadenceDate(contactId, step, today, clock.instant())) {
            throw new ConsistencyViolationException(
                "Contact " + contactId + " " + step.label() + " was recorded concurrently"
            );
        }
        ledger.append(
            contact.opportunityId(),
            contactId,
            step.activityType(),
            step.label() + " outreach sent to " + contact.fullName(),
            Map.of("step", step.label(), "sent_on", today.toString())
        );

        Contact updated = contacts.findById(contactId);
        if (updated == null || !updated.cadenceOrdered()) {
            throw new ConsistencyViolationException("Cadence out of order for contact " + contactId);
        }
        log.info("Contact {} {} recorded on {}", contactId, step.label(), today);
        return updated;
    }

    /**
     * Pending contacts whose first outreach is at least the configured number of days old.
     */
    public List<Contact> staleWaitingOn() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getFollowUp().getWaitingOnDays());
        return contacts.findWaitingOn(cutoff);
    }

    void requirePredecessorSent(Contact contact, CadenceStep step) {
        CadenceStep previous = step.previous();
        if (previous != null && contact.cadenceDate(previous) == null) {
            throw new ValidationException(
                "Cannot record " + step.label() + " for contact " + contact.id()
                    + " before " + previous.label() + " is sent"
            );
        }
    }
}
