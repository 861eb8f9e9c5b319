package com.caseflow.worker;

/**
 * Direction of a stage transition notification.
 */
public enum TransitionDirection {
    ENTERED,
    EXITED
}
