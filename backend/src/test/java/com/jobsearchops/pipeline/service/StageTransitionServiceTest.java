package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.exception.NotFoundException;
import com.jobsearchops.pipeline.exception.ValidationException;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.CloseReason;
import com.jobsearchops.pipeline.model.NextAction;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.OpportunitySource;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageTransitionServiceTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 14);

    @Mock
    private OpportunityRepository opportunities;
    @Mock
    private ActivityLedger ledger;

    private StageTransitionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atTime(9, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new StageTransitionService(opportunities, ledger, clock);
    }

    @Test
    void closedWithoutReasonIsRejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> service.transition(1L, Stage.CLOSED, null, null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("close_reason");
        verifyNoInteractions(opportunities, ledger);
    }

    @Test
    void unknownOpportunityIsNotFound() {
        when(opportunities.findByIdForUpdate(404L)).thenReturn(null);

        assertThatThrownBy(() -> service.transition(404L, Stage.APPLIED))
            .isInstanceOf(NotFoundException.class);
        verify(opportunities, never()).updateStage(anyLong(), any(), any(), any(), any(), any(), any());
        verifyNoInteractions(ledger);
    }

    @Test
    void appliedStampsDateAppliedAndRecomputesNextAction() {
        when(opportunities.findByIdForUpdate(7L)).thenReturn(opportunity(7L, Stage.WARM_LEAD, null, null));

        service.transition(7L, Stage.APPLIED, null, "Submitted via referral");

        ArgumentCaptor<NextAction> nextAction = ArgumentCaptor.forClass(NextAction.class);
        verify(opportunities).updateStage(
            eq(7L), eq(Stage.APPLIED), isNull(), eq(TODAY), isNull(), nextAction.capture(), any(Instant.class)
        );
        assertThat(nextAction.getValue().dueDate()).isEqualTo(TODAY.plusDays(7));
        verify(ledger).append(
            eq(7L), isNull(), eq(ActivityType.STAGE_CHANGE), contains("Warm Lead → Applied"), anyMap()
        );
    }

    @Test
    void dateAppliedIsKeptWhenAlreadySet() {
        LocalDate firstApplied = TODAY.minusDays(20);
        when(opportunities.findByIdForUpdate(8L)).thenReturn(opportunity(8L, Stage.LOOP, null, firstApplied));

        service.transition(8L, Stage.APPLIED);

        verify(opportunities).updateStage(
            eq(8L), eq(Stage.APPLIED), isNull(), eq(firstApplied), isNull(), any(NextAction.class), any(Instant.class)
        );
    }

    @Test
    void closingStoresReasonAndClearsNextAction() {
        when(opportunities.findByIdForUpdate(9L)).thenReturn(opportunity(9L, Stage.OFFER_PENDING, null, TODAY));

        service.transition(9L, Stage.CLOSED, CloseReason.ACCEPTED, null);

        verify(opportunities).updateStage(
            eq(9L), eq(Stage.CLOSED), eq(CloseReason.ACCEPTED), eq(TODAY), eq(TODAY), isNull(), any(Instant.class)
        );
    }

    @Test
    void reopeningClearsCloseReasonAndIgnoresSuppliedReason() {
        when(opportunities.findByIdForUpdate(10L)).thenReturn(opportunity(10L, Stage.CLOSED, CloseReason.REJECTED, null));

        service.transition(10L, Stage.LOOP, CloseReason.WITHDREW, null);

        verify(opportunities).updateStage(
            eq(10L), eq(Stage.LOOP), isNull(), isNull(), isNull(), any(NextAction.class), any(Instant.class)
        );
    }

    @Test
    void backwardMovesAreAllowed() {
        when(opportunities.findByIdForUpdate(11L)).thenReturn(opportunity(11L, Stage.LOOP, null, TODAY));

        service.transition(11L, Stage.PROSPECT);

        verify(ledger).append(eq(11L), isNull(), eq(ActivityType.STAGE_CHANGE), contains("Loop → Prospect"), anyMap());
    }

    private Opportunity opportunity(long id, Stage stage, CloseReason reason, LocalDate dateApplied) {
        return new Opportunity(
            id, "Acme", "Analytics Manager", null, 2, stage, OpportunitySource.LINKEDIN,
            TODAY.minusDays(30), dateApplied, reason == null ? null : TODAY.minusDays(1), reason,
            7, null, "https://jobs.example.com/" + id, null, null, null, null, null, null, null,
            Instant.EPOCH, Instant.EPOCH
        );
    }
}
