package com.caseflow.core.repository;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Event persistence.
 * Events are append-only and immutable.
 */
public interface EventRepository {

    /**
     * Append a new event to the log.
     *
     * @param event The event to append
     * @return false if an event with the same idempotency key already exists
     */
    boolean append(Event event);

    /**
     * Find an event by idempotency key.
     *
     * @param idempotencyKey The idempotency key
     * @return The event if found
     */
    Optional<Event> findByIdempotencyKey(String idempotencyKey);

    /**
     * Get all events for a workflow instance in order.
     *
     * @param workflowInstanceId The workflow instance ID
     * @return All events ordered by sequence number
     */
    List<Event> findByWorkflowInstance(UUID workflowInstanceId);

    /**
     * Get events for a workflow instance after a sequence number.
     *
     * @param workflowInstanceId The workflow instance ID
     * @param afterSequence Sequence number to start after (exclusive)
     * @return Events with a higher sequence number, in order
     */
    List<Event> findByWorkflowInstanceAfter(UUID workflowInstanceId, long afterSequence);

    /**
     * Get events for a workflow instance of specific types.
     *
     * @param workflowInstanceId The workflow instance ID
     * @param types Event types to filter by
     * @return Matching events ordered by sequence number
     */
    List<Event> findByWorkflowInstanceAndTypes(UUID workflowInstanceId, List<EventType> types);

    /**
     * Get the highest sequence number for a workflow instance.
     *
     * @param workflowInstanceId The workflow instance ID
     * @return Highest sequence number (0 if no events exist)
     */
    long getLatestSequenceNumber(UUID workflowInstanceId);

    /**
     * Count events by type for a workflow instance.
     *
     * @param workflowInstanceId The workflow instance ID
     * @return Count per event type
     */
    Map<EventType, Long> countByType(UUID workflowInstanceId);
}
