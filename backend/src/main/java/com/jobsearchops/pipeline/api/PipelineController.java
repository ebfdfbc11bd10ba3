package com.jobsearchops.pipeline.api;

import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.feed.FeedIngestionService;
import com.jobsearchops.pipeline.model.ActivityLogEntry;
import com.jobsearchops.pipeline.model.CadenceStep;
import com.jobsearchops.pipeline.model.CloseReason;
import com.jobsearchops.pipeline.model.Contact;
import com.jobsearchops.pipeline.model.ContactType;
import com.jobsearchops.pipeline.model.DueFollowUp;
import com.jobsearchops.pipeline.model.FeedPollResult;
import com.jobsearchops.pipeline.model.JobFamily;
import com.jobsearchops.pipeline.model.NewContact;
import com.jobsearchops.pipeline.model.NewOpportunity;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.OpportunitySource;
import com.jobsearchops.pipeline.model.PersistedLabel;
import com.jobsearchops.pipeline.model.PipelineSummaryRow;
import com.jobsearchops.pipeline.model.ResponseStatus;
import com.jobsearchops.pipeline.model.SchedulerStatus;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.model.TodayQueueItem;
import com.jobsearchops.pipeline.persistence.PipelineViewRepository;
import com.jobsearchops.pipeline.scheduler.DailyJobScheduler;
import com.jobsearchops.pipeline.service.ActivityLedger;
import com.jobsearchops.pipeline.service.ContactService;
import com.jobsearchops.pipeline.service.FollowUpService;
import com.jobsearchops.pipeline.service.OpportunityService;
import com.jobsearchops.pipeline.service.OutreachService;
import com.jobsearchops.pipeline.service.StageTransitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private static final int DEFAULT_ACTIVITY_LIMIT = 50;

    private final OpportunityService opportunityService;
    private final StageTransitionService stageTransitionService;
    private final ContactService contactService;
    private final FollowUpService followUpService;
    private final OutreachService outreachService;
    private final FeedIngestionService feedIngestionService;
    private final ActivityLedger ledger;
    private final PipelineViewRepository views;
    private final DailyJobScheduler scheduler;
    private final Clock clock;

    public PipelineController(
        OpportunityService opportunityService,
        StageTransitionService stageTransitionService,
        ContactService contactService,
        FollowUpService followUpService,
        OutreachService outreachService,
        FeedIngestionService feedIngestionService,
        ActivityLedger ledger,
        PipelineViewRepository views,
        DailyJobScheduler scheduler,
        Clock clock
    ) {
        this.opportunityService = opportunityService;
        this.stageTransitionService = stageTransitionService;
        this.contactService = contactService;
        this.followUpService = followUpService;
        this.outreachService = outreachService;
        this.feedIngestionService = feedIngestionService;
        this.ledger = ledger;
        this.views = views;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostMapping("/opportunities")
    public ResponseEntity<Opportunity> createOpportunity(@RequestBody CreateOpportunityRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        NewOpportunity opportunity = new NewOpportunity(
            request.company(),
            request.roleTitle(),
            PersistedLabel.parseNullable(JobFamily.values(), request.jobFamily(), "job family"),
            request.tier(),
            PersistedLabel.parseNullable(OpportunitySource.values(), request.source(), "source"),
            request.fitScore(),
            request.salaryRange(),
            request.jdUrl(),
            request.jdRaw(),
            null,
            request.notes()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(opportunityService.create(opportunity));
    }

    @GetMapping("/opportunities/{id}")
    public Opportunity getOpportunity(@PathVariable("id") long id) {
        return opportunityService.get(id);
    }

    @PostMapping("/opportunities/{id}/stage")
    public Opportunity transition(@PathVariable("id") long id, @RequestBody StageTransitionRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        Stage stage = Stage.fromLabel(request.stage());
        CloseReason closeReason = PersistedLabel.parseNullable(CloseReason.values(), request.closeReason(), "close reason");
        return stageTransitionService.transition(id, stage, closeReason, request.note());
    }

    @PostMapping("/contacts")
    public ResponseEntity<Contact> createContact(@RequestBody CreateContactRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        Contact contact = contactService.create(new NewContact(
            request.opportunityId(),
            request.fullName(),
            request.title(),
            request.company(),
            request.linkedinUrl(),
            request.email(),
            PersistedLabel.parseNullable(ContactType.values(), request.contactType(), "contact type"),
            request.notes()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(contact);
    }

    @GetMapping("/contacts/{id}")
    public Contact getContact(@PathVariable("id") long id) {
        return contactService.get(id);
    }

    @PostMapping("/contacts/{id}/cadence/{step}")
    public Contact markSent(@PathVariable("id") long id, @PathVariable("step") String step) {
        return followUpService.markSent(id, CadenceStep.fromLabel(step));
    }

    @PostMapping("/contacts/{id}/follow-ups/{step}/send")
    public Contact sendFollowUp(
        @PathVariable("id") long id,
        @PathVariable("step") String step,
        @RequestBody SendFollowUpRequest request
    ) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        return outreachService.sendFollowUp(id, CadenceStep.fromLabel(step), request.subject(), request.body());
    }

    @PostMapping("/contacts/{id}/response")
    public Contact recordResponse(@PathVariable("id") long id, @RequestBody ResponseStatusRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        return contactService.recordResponse(id, ResponseStatus.fromLabel(request.status()));
    }

    @PostMapping("/contacts/{id}/call")
    public Contact recordCall(@PathVariable("id") long id, @RequestBody(required = false) CallCompletedRequest request) {
        boolean referralAsked = request != null && Boolean.TRUE.equals(request.referralAsked());
        boolean referralGiven = request != null && Boolean.TRUE.equals(request.referralGiven());
        return contactService.recordCallCompleted(id, referralAsked, referralGiven, request == null ? null : request.note());
    }

    @GetMapping("/follow-ups/due")
    public List<DueFollowUp> dueFollowUps() {
        return followUpService.dueFollowUps();
    }

    @GetMapping("/contacts/waiting-on")
    public List<Contact> waitingOn() {
        return followUpService.staleWaitingOn();
    }

    @PostMapping("/feeds/poll")
    public FeedPollResult pollFeeds() {
        return feedIngestionService.pollConfigured();
    }

    @GetMapping("/activity")
    public List<ActivityLogEntry> activity(
        @RequestParam(name = "opportunityId", required = false) Long opportunityId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ledger.recent(opportunityId, limit == null ? DEFAULT_ACTIVITY_LIMIT : limit);
    }

    @GetMapping("/pipeline/summary")
    public List<PipelineSummaryRow> pipelineSummary() {
        return views.pipelineSummary();
    }

    @GetMapping("/pipeline/today")
    public List<TodayQueueItem> todayQueue() {
        return views.todayQueue(LocalDate.now(clock));
    }

    @GetMapping("/scheduler/status")
    public SchedulerStatus schedulerStatus() {
        return scheduler.getStatus();
    }
}
