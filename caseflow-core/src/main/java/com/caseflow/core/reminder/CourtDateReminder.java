package com.caseflow.core.reminder;

import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.ReminderWindow;

/**
 * A court date reminder that is due, identified by the court date's position in the instance.
 */
public record CourtDateReminder(
    int index,
    CourtDate courtDate,
    ReminderWindow window,
    long hoursUntil
) {
}
