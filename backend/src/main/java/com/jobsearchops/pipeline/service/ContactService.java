package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.NewContact;
import com.jobsearchops.pipeline.model.ResponseStatus;
import com.jobsearchops.pipeline.persistence.ContactRepository;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ContactService {
    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    private final ContactRepository contacts;
    private final OpportunityRepository opportunities;
    private final ActivityLedger ledger;
    private final Clock clock;

    public ContactService(
        ContactRepository contacts,
        OpportunityRepository opportunities,
        ActivityLedger ledger,
        Clock clock
    ) {
        this.contacts = contacts;
        this.opportunities = opportunities;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Transactional
    public Contact create(NewContact request) {
        if (request == null || request.fullName() == null || request.fullName().isBlank()) {
            throw new ValidationException("full_name is required");
        }
        if (request.opportunityId() != null && opportunities.findById(request.opportunityId()) == null) {
            throw NotFoundException.opportunity(request.opportunityId());
        }
        long id = contacts.insert(request, clock.instant());
        ledger.append(request.opportunityId(), id, ActivityType.NOTE_ADDED, "Contact added: " + request.fullName());
        log.info("Created contact {} for opportunity {}", id, request.opportunityId());
        return contacts.findById(id);
    }

    public Contact get(long contactId) {
        Contact contact = contacts.findById(contactId);
        if (contact == null) {
            throw NotFoundException.contact(contactId);
        }
        return contact;
    }

    @Transactional
    public Contact recordResponse(long contactId, ResponseStatus status) {
        if (status == null) {
            throw new ValidationException("response_status is required");
        }
        Contact contact = contacts.findByIdForUpdate(contactId);
        if (contact == null) {
            throw NotFoundException.contact(contactId);
        }
        contacts.updateResponseStatus(contactId, status, clock.instant());
        ledger.append(
            contact.opportunityId(),
            contactId,
            ActivityType.RESPONSE_RECEIVED,
            "Response from " + contact.fullName() + ": " + contact.responseStatus().label() + " → " + status.label(),
            Map.of("from", contact.responseStatus().label(), "to", status.label())
        );
        return contacts.findById(contactId);
    }

    @Transactional
    public Contact recordCallCompleted(long contactId, boolean referralAsked, boolean referralGiven, String note) {
        Contact contact = contacts.findByIdForUpdate(contactId);
        if (contact == null) {
            throw NotFoundException.contact(contactId);
        }
        contacts.markCallCompleted(contactId, referralAsked, referralGiven, clock.instant());
        String description = "Call completed with " + contact.fullName();
        if (note != null && !note.isBlank()) {
            description = description + ". " + note.trim();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("referral_asked", referralAsked);
        metadata.put("referral_given", referralGiven);
        ledger.append(contact.opportunityId(), contactId, ActivityType.CALL_COMPLETED, description, metadata);
        return contacts.findById(contactId);
    }
}
