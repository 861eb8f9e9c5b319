package com.caseflow.core.model;

/**
 * Court date reminder windows, by hours remaining until the hearing.
 */
public enum ReminderWindow {
    /**
     * 24 &lt; hoursUntil &lt;= 48.
     */
    HOURS_48,

    /**
     * 0 &lt; hoursUntil &lt;= 24.
     */
    HOURS_24
}
