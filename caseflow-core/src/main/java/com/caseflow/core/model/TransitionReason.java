package com.caseflow.core.model;

/**
 * Why a stage transition was requested.
 */
public enum TransitionReason {
    /**
     * Entering the initial stage after the template is loaded.
     */
    INITIAL,

    /**
     * A transition-stage signal named the target.
     */
    EXPLICIT,

    /**
     * An auto-transition stage had all requirements satisfied.
     */
    AUTO,

    /**
     * An approver completed the current stage by manual override.
     */
    OVERRIDE
}
