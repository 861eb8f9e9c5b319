package com.caseflow.worker;

import com.caseflow.core.model.EntityType;

import java.util.UUID;

/**
 * Context passed to every activity call.
 */
public class ActivityContext {

    private final UUID workflowInstanceId;
    private final String workflowId;
    private final EntityType entityType;
    private final String activityName;
    private final String idempotencyKey;
    private final int attemptNumber;

    public ActivityContext(
            UUID workflowInstanceId,
            String workflowId,
            EntityType entityType,
            String activityName,
            String idempotencyKey,
            int attemptNumber) {
        this.workflowInstanceId = workflowInstanceId;
        this.workflowId = workflowId;
        this.entityType = entityType;
        this.activityName = activityName;
        this.idempotencyKey = idempotencyKey;
        this.attemptNumber = attemptNumber;
    }

    public UUID getWorkflowInstanceId() {
        return workflowInstanceId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getActivityName() {
        return activityName;
    }

    /**
     * Get the idempotency key for this call.
     * Stable across retries, so external systems can deduplicate.
     */
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    ActivityContext withAttempt(int attempt) {
        return new ActivityContext(workflowInstanceId, workflowId, entityType,
            activityName, idempotencyKey, attempt);
    }
}
