package com.caseflow.core.query;

import com.caseflow.core.model.Stage;
import com.caseflow.core.model.WorkflowInstance;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views over an instance state. Never touches history or activities.
 */
public final class WorkflowQueries {

    private WorkflowQueries() {
    }

    public static WorkflowInstance workflowState(WorkflowInstance state) {
        return state;
    }

    public static CurrentStageView currentStage(WorkflowInstance state) {
        Optional<Stage> stage = state.currentStage();
        return new CurrentStageView(
            stage.orElse(null),
            state.currentStageId(),
            state.currentStageEnteredAt()
        );
    }

    /**
     * Completed requirements are those recorded while the current stage was current,
     * including ids the stage does not list. Pending are listed ids not yet completed.
     */
    public static RequirementsView requirements(WorkflowInstance state) {
        Optional<Stage> stage = state.currentStage();
        if (stage.isEmpty()) {
            return new RequirementsView(null, List.of(), List.of());
        }
        List<String> completed = state.completedRequirementIds(stage.get().stageId());
        List<String> pending = stage.get().requirements().stream()
            .filter(r -> !completed.contains(r))
            .toList();
        return new RequirementsView(stage.get().stageId(), completed, pending);
    }
}
