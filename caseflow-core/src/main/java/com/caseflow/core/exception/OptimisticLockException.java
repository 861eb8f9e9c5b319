package com.caseflow.core.exception;

/**
 * Thrown when an event cannot be appended because its sequence number is already taken,
 * meaning another process is driving the same instance.
 */
public class OptimisticLockException extends OrchestratorException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String workflowId, long sequenceNumber) {
        super(ERROR_CODE, String.format(
            "Event sequence conflict on workflow %s: sequence %d already written",
            workflowId, sequenceNumber
        ));
    }
}
