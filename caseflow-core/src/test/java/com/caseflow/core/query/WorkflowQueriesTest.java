package com.caseflow.core.query;

import com.caseflow.core.model.CompletedRequirement;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowInstance;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkflowQueriesTest {

    private static final Instant ENTERED = Instant.parse("2026-02-01T10:00:00Z");

    private final WorkflowInstance state = WorkflowInstance.builder()
        .instanceId(UUID.randomUUID())
        .stages(List.of(
            Stage.builder().stageId("filed").name("Case Filed").order(1)
                .requirements(List.of("complaint")).build(),
            Stage.builder().stageId("review").name("Document Review").order(2)
                .requirements(List.of("evidence", "contract")).build()))
        .currentStageId("review")
        .currentStageEnteredAt(ENTERED)
        .completedRequirements(List.of(
            new CompletedRequirement("complaint", "filed", ENTERED.minusSeconds(60), null),
            new CompletedRequirement("evidence", "review", ENTERED.plusSeconds(60), null),
            // Completed in an earlier stage, does not count here
            new CompletedRequirement("contract", "filed", ENTERED.minusSeconds(30), null)))
        .build();

    @Test
    void currentStage_returnsStageAndEntryTime() {
        CurrentStageView view = WorkflowQueries.currentStage(state);

        assertThat(view.stageId()).isEqualTo("review");
        assertThat(view.stage().name()).isEqualTo("Document Review");
        assertThat(view.enteredAt()).isEqualTo(ENTERED);
    }

    @Test
    void requirements_areScopedToCurrentStage() {
        RequirementsView view = WorkflowQueries.requirements(state);

        assertThat(view.stageId()).isEqualTo("review");
        assertThat(view.completed()).containsExactly("evidence");
        assertThat(view.pending()).containsExactly("contract");
    }

    @Test
    void beforeInitialStage_viewsAreEmpty() {
        WorkflowInstance fresh = WorkflowInstance.empty(UUID.randomUUID());

        assertThat(WorkflowQueries.currentStage(fresh).stageId()).isNull();
        assertThat(WorkflowQueries.requirements(fresh).pending()).isEmpty();
    }
}
