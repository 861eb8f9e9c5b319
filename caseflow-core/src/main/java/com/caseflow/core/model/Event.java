package com.caseflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to a workflow instance.
 * Append-only log used for audit, recovery and replay.
 *
 * Primary Key: eventId
 * Index: (workflowInstanceId, sequenceNumber)
 *
 * Invariants:
 * - sequenceNumber is contiguous within instance, starting at 1
 * - Events are never deleted or modified
 * - idempotencyKey prevents duplicate events
 */
public record Event(
    // Primary key
    UUID eventId,

    // Foreign key
    UUID workflowInstanceId,

    // Ordering
    long sequenceNumber,

    // Event data
    EventType type,
    Instant timestamp,
    JsonNode payload,

    String idempotencyKey,

    // Actor (who/what caused this event)
    String actorType,
    String actorId
) {
    public static final String ACTOR_SYSTEM = "SYSTEM";
    public static final String ACTOR_LOOP = "LOOP";
    public static final String ACTOR_SIGNAL = "SIGNAL";
    public static final String ACTOR_RECOVERY = "RECOVERY";
    public static final String ACTOR_USER = "USER";

    public static Event create(
            UUID workflowInstanceId,
            long sequenceNumber,
            EventType type,
            Instant timestamp,
            JsonNode payload,
            String idempotencyKey,
            String actorType,
            String actorId) {
        return new Event(
            UUID.randomUUID(),
            workflowInstanceId,
            sequenceNumber,
            type,
            timestamp,
            payload,
            idempotencyKey,
            actorType,
            actorId
        );
    }

    /**
     * Check if this event is a workflow lifecycle event.
     */
    public boolean isWorkflowEvent() {
        return type.name().startsWith("WORKFLOW_");
    }

    public boolean isReminderEvent() {
        return type == EventType.DEADLINE_REMINDER_SENT
            || type == EventType.DEADLINE_OVERDUE_NOTIFIED
            || type == EventType.COURT_DATE_REMINDER_SENT;
    }
}
