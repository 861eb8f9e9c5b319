package com.caseflow.engine.service;

import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.query.CurrentStageView;
import com.caseflow.core.query.RequirementsView;
import com.caseflow.core.query.WorkflowResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Core service for lifecycle orchestration.
 * Instances are addressed by their caller-supplied workflow id.
 */
public interface WorkflowService {

    /**
     * Start a lifecycle workflow for a case or an employee.
     * Starting twice with the same workflow id returns the existing instance.
     *
     * @param request The start request
     * @return The state right after WORKFLOW_STARTED was recorded
     * @throws com.caseflow.core.exception.DuplicateInstanceException if another
     *         instance is still active for the same entity
     */
    WorkflowInstance startWorkflow(StartWorkflowRequest request);

    // ========== Signals ==========

    /**
     * Queue completion of a requirement of the current stage.
     */
    void completeRequirement(String workflowId, String requirementId, String notes);

    /**
     * Request a transition. A newer request replaces one that was not applied yet.
     */
    void transitionStage(String workflowId, String targetStageId, String notes);

    void addDeadline(String workflowId, Instant date, String description);

    void addCourtDate(String workflowId, Instant date, String description);

    /**
     * Complete the current stage on an approver's authority, moving to the next stage
     * regardless of its requirements. Recorded with reason and approver for audit.
     */
    void manualOverride(String workflowId, String reason, String approvedBy);

    /**
     * Record an escalation of the instance's current stage. Does not change the stage.
     */
    void escalate(String workflowId, String reason, String escalatedTo);

    void pauseWorkflow(String workflowId);

    void resumeWorkflow(String workflowId);

    /**
     * Cancel immediately. Exit effects of the current stage are not run.
     */
    void cancelWorkflow(String workflowId, String reason);

    // ========== Queries ==========

    WorkflowInstance getWorkflowState(String workflowId);

    CurrentStageView getCurrentStage(String workflowId);

    RequirementsView getRequirements(String workflowId);

    /**
     * Get an instance by its internal id.
     */
    WorkflowInstance getWorkflow(UUID instanceId);

    List<WorkflowInstance> listWorkflows(WorkflowQuery query);

    WorkflowStatistics statistics();

    /**
     * Wait for the instance to finish.
     *
     * @throws com.caseflow.core.exception.WorkflowExecutionException if it failed or was cancelled
     * @throws TimeoutException if it is still running after the timeout
     */
    WorkflowResult awaitResult(String workflowId, Duration timeout) throws TimeoutException;

    /**
     * Request to start a workflow.
     *
     * @param workflowId Idempotency id; generated when null
     */
    record StartWorkflowRequest(
        String workflowId,
        String entityId,
        EntityType entityType,
        String templateId,
        JsonNode input
    ) {}

    /**
     * Filter for listing workflows. Null fields match everything.
     */
    record WorkflowQuery(
        WorkflowStatus status,
        String entityId,
        int limit
    ) {
        public static final int DEFAULT_LIMIT = 100;

        public WorkflowQuery {
            if (limit <= 0) {
                limit = DEFAULT_LIMIT;
            }
        }
    }

    record WorkflowStatistics(
        Map<WorkflowStatus, Long> byStatus,
        int liveRunners
    ) {}
}
