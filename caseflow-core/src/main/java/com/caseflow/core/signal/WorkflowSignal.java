package com.caseflow.core.signal;

import java.time.Instant;
import java.util.Objects;

/**
 * A typed command delivered to one workflow instance.
 * Only the fields relevant to the signal type are set; the factories validate them.
 *
 * For CANCEL, ESCALATE and MANUAL_OVERRIDE the reason is carried in {@code notes}.
 */
public record WorkflowSignal(
    SignalType type,
    String requirementId,
    String targetStageId,
    Instant date,
    String description,
    String notes,
    String escalatedTo,
    String approvedBy
) {
    /**
     * Dates outside years 1 to 9999 are rejected so reminder arithmetic never overflows.
     */
    public static final Instant MIN_DATE = Instant.parse("0001-01-01T00:00:00Z");
    public static final Instant MAX_DATE = Instant.parse("9999-12-31T23:59:59Z");

    public WorkflowSignal {
        Objects.requireNonNull(type, "type");
    }

    public static WorkflowSignal completeRequirement(String requirementId, String notes) {
        requireText(requirementId, "requirementId");
        return of(SignalType.COMPLETE_REQUIREMENT, requirementId, null, null, null, notes);
    }

    public static WorkflowSignal transitionStage(String targetStageId, String notes) {
        requireText(targetStageId, "targetStageId");
        return of(SignalType.TRANSITION_STAGE, null, targetStageId, null, null, notes);
    }

    public static WorkflowSignal addDeadline(Instant date, String description) {
        requireDate(date);
        return of(SignalType.ADD_DEADLINE, null, null, date, description, null);
    }

    public static WorkflowSignal addCourtDate(Instant date, String description) {
        requireDate(date);
        return of(SignalType.ADD_COURT_DATE, null, null, date, description, null);
    }

    public static WorkflowSignal pause() {
        return of(SignalType.PAUSE, null, null, null, null, null);
    }

    public static WorkflowSignal resume() {
        return of(SignalType.RESUME, null, null, null, null, null);
    }

    public static WorkflowSignal cancel(String reason) {
        return of(SignalType.CANCEL, null, null, null, null, reason);
    }

    public static WorkflowSignal escalate(String reason, String escalatedTo) {
        requireText(reason, "reason");
        requireText(escalatedTo, "escalatedTo");
        return new WorkflowSignal(SignalType.ESCALATE, null, null, null, null, reason, escalatedTo, null);
    }

    public static WorkflowSignal manualOverride(String reason, String approvedBy) {
        requireText(reason, "reason");
        requireText(approvedBy, "approvedBy");
        return new WorkflowSignal(SignalType.MANUAL_OVERRIDE, null, null, null, null, reason, null, approvedBy);
    }

    private static WorkflowSignal of(SignalType type, String requirementId, String targetStageId,
                                     Instant date, String description, String notes) {
        return new WorkflowSignal(type, requirementId, targetStageId, date, description, notes, null, null);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static void requireDate(Instant date) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        if (date.isBefore(MIN_DATE) || date.isAfter(MAX_DATE)) {
            throw new IllegalArgumentException("date must be between " + MIN_DATE + " and " + MAX_DATE + ": " + date);
        }
    }
}
