package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.TransientIoException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.external.EmailSender;
import com.jobsearchops.pipeline.model.CadenceStep;
import com.jobsearchops.pipeline.model.Contact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends a cadence email and records the step only after the sender confirms it. The send itself
 * runs outside any transaction.
 */
@Service
public class OutreachService {
    private static final Logger log = LoggerFactory.getLogger(OutreachService.class);

    private final ContactService contactService;
    private final FollowUpService followUpService;
    private final EmailSender emailSender;

    public OutreachService(ContactService contactService, FollowUpService followUpService, EmailSender emailSender) {
        this.contactService = contactService;
        this.followUpService = followUpService;
        this.emailSender = emailSender;
    }

    public Contact sendFollowUp(long contactId, CadenceStep step, String subject, String body) {
        if (step == null) {
            throw new ValidationException("cadence step is required");
        }
        Contact contact = contactService.get(contactId);
        if (contact.cadenceDate(step) != null) {
            log.info("Contact {} already has {} recorded; not sending again", contactId, step.label());
            return contact;
        }
        followUpService.requirePredecessorSent(contact, step);
        if (contact.email() == null || contact.email().isBlank()) {
            throw new ValidationException("Contact " + contactId + " has no email address");
        }
        if (subject == null || subject.isBlank()) {
            throw new ValidationException("subject is required");
        }

        boolean sent;
        try {
            sent = emailSender.send(contact.email(), subject, body == null ? "" : body);
        } catch (RuntimeException e) {
            throw new TransientIoException("email_send_error", "Email to contact " + contactId + " failed", e);
        }
        if (!sent) {
            throw new TransientIoException("email_not_sent", "Email to contact " + contactId + " was not sent");
        }
        return followUpService.markSent(contactId, step);
    }
}
