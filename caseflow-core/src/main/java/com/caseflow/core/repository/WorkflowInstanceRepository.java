package com.caseflow.core.repository;

import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow instance snapshots.
 * A snapshot is a cache of the event fold; the event log stays the source of truth.
 */
public interface WorkflowInstanceRepository {

    /**
     * Save the latest snapshot, replacing an older one.
     * A snapshot with a lower lastSequence than the stored one is ignored.
     *
     * @param instance The state to store
     */
    void save(WorkflowInstance instance);

    Optional<WorkflowInstance> findById(UUID instanceId);

    Optional<WorkflowInstance> findByWorkflowId(String workflowId);

    /**
     * Find instances for an entity, newest first.
     */
    List<WorkflowInstance> findByEntityId(String entityId);

    List<WorkflowInstance> findByStatus(WorkflowStatus status, int limit);

    List<WorkflowInstance> findAll(int limit);

    /**
     * Find instances still driven by a loop: RUNNING or PAUSED.
     */
    List<WorkflowInstance> findActive();

    /**
     * Count stored instances per status.
     */
    Map<WorkflowStatus, Long> countByStatus();
}
