package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.ActivityLogEntry;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.CadenceStep;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.ContactType;
import com.jobsearchops.pipeline.model.NewContact;
import com.jobsearchops.pipeline.model.NewOpportunity;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.ResponseStatus;
import com.jobsearchops.pipeline.persistence.ContactRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FollowUpServiceIntegrationTest {

    @Autowired
    private OpportunityService opportunityService;
    @Autowired
    private ContactService contactService;
    @Autowired
    private FollowUpService followUpService;
    @Autowired
    private ContactRepository contactRepository;
    @Autowired
    private ActivityLedger ledger;

    @Test
    void pendingContactThreeDaysAfterDay0IsWaitingOn() {
        Contact threeDays = contactWithDay0(LocalDate.now().minusDays(3));
        Contact oneDay = contactWithDay0(LocalDate.now().minusDays(1));

        List<Long> waitingIds = followUpService.staleWaitingOn().stream().map(Contact::id).toList();

        assertThat(waitingIds).contains(threeDays.id()).doesNotContain(oneDay.id());
    }

    @Test
    void respondedContactsAreNotWaitingOn() {
        Contact contact = contactWithDay0(LocalDate.now().minusDays(5));
        contactService.recordResponse(contact.id(), ResponseStatus.RESPONDED);

        List<Long> waitingIds = followUpService.staleWaitingOn().stream().map(Contact::id).toList();

        assertThat(waitingIds).doesNotContain(contact.id());
    }

    @Test
    void dueFollowUpsSeesDay3ForPendingContact() {
        Contact pending = contactWithDay0(LocalDate.now().minusDays(4));
        Contact responded = contactWithDay0(LocalDate.now().minusDays(4));
        contactService.recordResponse(responded.id(), ResponseStatus.RESPONDED);

        List<Long> dueDay3 = followUpService.dueFollowUps().stream()
            .filter(due -> due.step() == CadenceStep.DAY3)
            .map(due -> due.contact().id())
            .toList();

        assertThat(dueDay3).contains(pending.id()).doesNotContain(responded.id());
    }

    @Test
    void cadenceStaysOrderedThroughAllSteps() {
        Contact contact = newContact();

        assertThatThrownBy(() -> followUpService.markSent(contact.id(), CadenceStep.DAY7))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> followUpService.markSent(contact.id(), CadenceStep.DAY3))
            .isInstanceOf(ValidationException.class);

        followUpService.markSent(contact.id(), CadenceStep.DAY0);
        followUpService.markSent(contact.id(), CadenceStep.DAY3);
        Contact finished = followUpService.markSent(contact.id(), CadenceStep.DAY7);

        assertThat(finished.outreachDay3()).isNotNull();
        assertThat(finished.outreachDay3()).isBeforeOrEqualTo(finished.outreachDay7());
        assertThat(finished.cadenceOrdered()).isTrue();
        assertThat(FollowUpService.nextDue(finished, LocalDate.now().plusDays(30))).isNull();
    }

    @Test
    void secondMarkForSameStepWritesNothing() {
        Contact contact = newContact();

        followUpService.markSent(contact.id(), CadenceStep.DAY0);
        Contact again = followUpService.markSent(contact.id(), CadenceStep.DAY0);

        assertThat(again.outreachDay0()).isEqualTo(LocalDate.now());
        List<ActivityLogEntry> outreach = ledger.recent(contact.opportunityId(), 50).stream()
            .filter(entry -> entry.activityType() == ActivityType.OUTREACH_SENT)
            .toList();
        assertThat(outreach).hasSize(1);
        assertThat(outreach.get(0).contactId()).isEqualTo(contact.id());
    }

    private Contact contactWithDay0(LocalDate day0) {
        Contact contact = newContact();
        contactRepository.updateCadenceDate(contact.id(), CadenceStep.DAY0, day0, Instant.now());
        return contactRepository.findById(contact.id());
    }

    private Contact newContact() {
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        Opportunity opportunity = opportunityService.create(new NewOpportunity(
            "Cadence Co " + suffix, "Data Manager", null, 2, null, null, null, null, null, null, null
        ));
        return contactService.create(new NewContact(
            opportunity.id(), "Casey " + suffix, "Recruiter", "Cadence Co " + suffix, null,
            "casey" + suffix + "@example.com", ContactType.RECRUITER, null
        ));
    }
}
