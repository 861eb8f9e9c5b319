package com.caseflow.core.query;

import com.caseflow.core.model.WorkflowInstance;

/**
 * Final outcome of a workflow instance.
 */
public record WorkflowResult(
    boolean success,
    WorkflowInstance workflowState,
    String error
) {
    public static WorkflowResult completed(WorkflowInstance state) {
        return new WorkflowResult(true, state, null);
    }

    public static WorkflowResult failed(WorkflowInstance state, String error) {
        return new WorkflowResult(false, state, error);
    }
}
