package com.caseflow.core.exception;

import com.caseflow.core.model.WorkflowStatus;

/**
 * Thrown when an operation is not allowed in the instance's current status,
 * for example a signal sent to a completed instance.
 */
public class InvalidStateTransitionException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(WorkflowStatus currentStatus, WorkflowStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String workflowId, WorkflowStatus currentStatus, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot apply %s to workflow %s in status %s",
            operation, workflowId, currentStatus
        ));
    }
}
