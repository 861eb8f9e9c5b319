package com.caseflow.core.model;

/**
 * Kind of notification sent for a deadline.
 */
public enum DeadlineNotice {
    UPCOMING,
    OVERDUE
}
