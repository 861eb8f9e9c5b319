package com.caseflow.core.exception;

/**
 * Thrown when a workflow template fails validation.
 * Never retried: an invalid template cannot become valid by retrying.
 */
public class WorkflowValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkflowValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow template: %s - %s", field, reason));
    }
}
