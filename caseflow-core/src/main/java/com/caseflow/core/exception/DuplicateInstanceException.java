package com.caseflow.core.exception;

/**
 * Thrown when an active workflow already exists for the same entity.
 */
public class DuplicateInstanceException extends OrchestratorException {

    public static final String ERROR_CODE = "DUPLICATE_INSTANCE";

    private final String existingWorkflowId;

    public DuplicateInstanceException(String entityId, String existingWorkflowId) {
        super(ERROR_CODE, String.format(
            "An active workflow already exists for entity '%s': %s",
            entityId, existingWorkflowId
        ));
        this.existingWorkflowId = existingWorkflowId;
    }

    public String getExistingWorkflowId() {
        return existingWorkflowId;
    }
}
