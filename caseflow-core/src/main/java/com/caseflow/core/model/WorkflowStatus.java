package com.caseflow.core.model;

/**
 * Lifecycle status of a workflow instance.
 * Stage progression is tracked separately; this is the run status of the loop.
 */
public enum WorkflowStatus {
    /**
     * Loop active, stages progressing.
     * Transitions: -> PAUSED, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Loop gated: no transition, requirement processing or reminder check.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    PAUSED,

    /**
     * Terminal stage reached. Terminal state.
     */
    COMPLETED,

    /**
     * Activity failed permanently or template invalid. Terminal state.
     */
    FAILED,

    /**
     * Aborted by request without exit side effects. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the instance still accepts signals.
     */
    public boolean acceptsSignals() {
        return this == RUNNING || this == PAUSED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case RUNNING -> target == PAUSED || target == COMPLETED ||
                           target == FAILED || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
