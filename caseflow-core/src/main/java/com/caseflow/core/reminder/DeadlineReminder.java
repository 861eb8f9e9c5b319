package com.caseflow.core.reminder;

import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;

/**
 * A deadline notification that is due, identified by the deadline's position in the instance.
 */
public record DeadlineReminder(
    int index,
    Deadline deadline,
    DeadlineNotice notice,
    long daysUntil
) {
}
