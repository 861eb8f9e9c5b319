package com.caseflow.core.model;

/**
 * Types of events recorded in a workflow instance's history.
 * State is the fold of these events; nothing else mutates it.
 */
public enum EventType {
    // Workflow lifecycle events
    WORKFLOW_STARTED,
    TEMPLATE_LOADED,
    WORKFLOW_PAUSED,
    WORKFLOW_RESUMED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_CANCELLED,

    // Signal intake
    SIGNAL_RECEIVED,

    // Loop drains
    DEADLINE_ADDED,
    COURT_DATE_ADDED,
    REQUIREMENT_COMPLETED,
    REQUIREMENTS_CHECKED,
    MANUAL_OVERRIDE_APPLIED,

    // Stage transitions
    TRANSITION_STARTED,
    TRANSITION_EFFECT_COMPLETED,
    TRANSITION_REJECTED,
    STAGE_ENTERED,

    // Reminders
    DEADLINE_REMINDER_SENT,
    DEADLINE_OVERDUE_NOTIFIED,
    COURT_DATE_REMINDER_SENT,

    // Escalations
    ESCALATION_RAISED,
    STAGE_TIMEOUT_ESCALATED,

    // Recovery
    SNAPSHOT_CREATED
}
