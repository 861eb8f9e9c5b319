package com.caseflow.core.exception;

/**
 * Outcome of a workflow instance that did not complete: failed or cancelled.
 */
public class WorkflowExecutionException extends OrchestratorException {

    public static final String ERROR_CODE = "WORKFLOW_EXECUTION_FAILED";
    public static final String CANCELLED_CODE = "WORKFLOW_CANCELLED";

    private final String workflowId;

    public WorkflowExecutionException(String errorCode, String workflowId, String message, Throwable cause) {
        super(errorCode, String.format("Workflow %s did not complete: %s", workflowId, message), cause);
        this.workflowId = workflowId;
    }

    public static WorkflowExecutionException failed(String workflowId, Throwable cause) {
        return new WorkflowExecutionException(ERROR_CODE, workflowId, cause.getMessage(), cause);
    }

    public static WorkflowExecutionException cancelled(String workflowId, String reason) {
        return new WorkflowExecutionException(CANCELLED_CODE, workflowId,
            reason == null ? "cancelled" : "cancelled (" + reason + ")", null);
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
