package com.jobsearchops.pipeline.service;

import com.jobsearchops.pipeline.model.NextAction;
import com.jobsearchops.pipeline.model.Stage;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class NextActionPolicyTest {

    @Test
    void everyOpenStageHasAFutureNextAction() {
        LocalDate today = LocalDate.of(2024, 1, 10);
        for (Stage stage : Stage.values()) {
            NextAction action = NextActionPolicy.nextActionFor(stage, today);
            if (stage.isClosed()) {
                assertThat(action).isNull();
            } else {
                assertThat(action.text()).isNotBlank();
                assertThat(action.dueDate()).isAfter(today);
            }
        }
    }

    @Test
    void windowsFollowTheStageTable() {
        LocalDate today = LocalDate.of(2024, 1, 10);
        assertThat(NextActionPolicy.nextActionFor(Stage.PROSPECT, today).dueDate()).isEqualTo(today.plusDays(3));
        assertThat(NextActionPolicy.nextActionFor(Stage.WARM_LEAD, today).dueDate()).isEqualTo(today.plusDays(2));
        assertThat(NextActionPolicy.nextActionFor(Stage.APPLIED, today).dueDate()).isEqualTo(today.plusDays(7));
        assertThat(NextActionPolicy.nextActionFor(Stage.LOOP, today).dueDate()).isEqualTo(today.plusDays(1));
        assertThat(NextActionPolicy.nextActionFor(Stage.OFFER_PENDING, today).dueDate()).isEqualTo(today.plusDays(2));
    }
}
