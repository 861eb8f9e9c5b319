package com.caseflow.core.reminder;

import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.ReminderWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decides which deadline and court date notifications are due at a given instant,
 * and when the next one can become due.
 *
 * Deadlines:
 * - UPCOMING once when 0 < daysUntil <= 7
 * - OVERDUE once when daysUntil < 0
 *
 * Court dates, one flag per window:
 * - HOURS_48 once when 24 < hoursUntil <= 48
 * - HOURS_24 once when 0 < hoursUntil <= 24
 *
 * daysUntil and hoursUntil are rounded up from the millisecond difference.
 */
public final class ReminderPolicy {

    public static final long UPCOMING_DAYS = 7;

    private static final long DAY_MS = Duration.ofDays(1).toMillis();
    private static final long HOUR_MS = Duration.ofHours(1).toMillis();

    private ReminderPolicy() {
    }

    public static long daysUntil(Instant date, Instant now) {
        return ceilDiv(date.toEpochMilli() - now.toEpochMilli(), DAY_MS);
    }

    public static long hoursUntil(Instant date, Instant now) {
        return ceilDiv(date.toEpochMilli() - now.toEpochMilli(), HOUR_MS);
    }

    public static List<DeadlineReminder> dueDeadlineReminders(List<Deadline> deadlines, Instant now) {
        List<DeadlineReminder> due = new ArrayList<>();
        for (int i = 0; i < deadlines.size(); i++) {
            Deadline deadline = deadlines.get(i);
            long days = daysUntil(deadline.date(), now);
            if (days > 0 && days <= UPCOMING_DAYS && !deadline.reminded()) {
                due.add(new DeadlineReminder(i, deadline, DeadlineNotice.UPCOMING, days));
            } else if (days < 0 && !deadline.overdueNotified()) {
                due.add(new DeadlineReminder(i, deadline, DeadlineNotice.OVERDUE, days));
            }
        }
        return due;
    }

    public static List<CourtDateReminder> dueCourtDateReminders(List<CourtDate> courtDates, Instant now) {
        List<CourtDateReminder> due = new ArrayList<>();
        for (int i = 0; i < courtDates.size(); i++) {
            CourtDate courtDate = courtDates.get(i);
            long hours = hoursUntil(courtDate.date(), now);
            if (hours > 24 && hours <= 48 && !courtDate.reminded48h()) {
                due.add(new CourtDateReminder(i, courtDate, ReminderWindow.HOURS_48, hours));
            } else if (hours > 0 && hours <= 24 && !courtDate.reminded24h()) {
                due.add(new CourtDateReminder(i, courtDate, ReminderWindow.HOURS_24, hours));
            }
        }
        return due;
    }

    /**
     * Earliest instant after {@code now} at which a not-yet-sent notification enters its window
     * or the current stage times out.
     *
     * @param stageTimeoutAt When the current stage escalates; null if it has no pending timeout
     */
    public static Optional<Instant> nextThreshold(List<Deadline> deadlines, List<CourtDate> courtDates,
                                                  Instant stageTimeoutAt, Instant now) {
        List<Instant> candidates = new ArrayList<>();
        Consumer<Instant> consider = t -> {
            if (t.isAfter(now)) {
                candidates.add(t);
            }
        };

        for (Deadline deadline : deadlines) {
            if (!deadline.reminded()) {
                consider.accept(deadline.date().minus(Duration.ofDays(UPCOMING_DAYS)));
            }
            if (!deadline.overdueNotified()) {
                consider.accept(deadline.date().plus(Duration.ofDays(1)));
            }
        }
        for (CourtDate courtDate : courtDates) {
            if (!courtDate.reminded48h()) {
                consider.accept(courtDate.date().minus(Duration.ofHours(48)));
            }
            if (!courtDate.reminded24h()) {
                consider.accept(courtDate.date().minus(Duration.ofHours(24)));
            }
        }
        if (stageTimeoutAt != null) {
            consider.accept(stageTimeoutAt);
        }
        return candidates.stream().min(Instant::compareTo);
    }

    static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
