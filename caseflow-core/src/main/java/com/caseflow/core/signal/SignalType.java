package com.caseflow.core.signal;

/**
 * Commands a running instance accepts.
 */
public enum SignalType {
    COMPLETE_REQUIREMENT,
    TRANSITION_STAGE,
    ADD_DEADLINE,
    ADD_COURT_DATE,
    MANUAL_OVERRIDE,
    ESCALATE,
    PAUSE,
    RESUME,
    CANCEL;

    /**
     * Queued signals are drained by the loop; the others take effect on receipt.
     */
    public boolean isQueued() {
        return this == COMPLETE_REQUIREMENT || this == TRANSITION_STAGE
            || this == ADD_DEADLINE || this == ADD_COURT_DATE || this == MANUAL_OVERRIDE;
    }
}
