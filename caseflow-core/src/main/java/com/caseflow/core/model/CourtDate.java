package com.caseflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A hearing date. Reminders fire once in the 48 hour window and once in the
 * 24 hour window, each tracked by its own monotonic flag.
 */
public record CourtDate(
    Instant date,
    String description,
    boolean reminded48h,
    boolean reminded24h
) {
    public static CourtDate of(Instant date, String description) {
        return new CourtDate(date, description, false, false);
    }

    /**
     * True once any reminder has been delivered for this court date.
     */
    @JsonIgnore
    public boolean reminded() {
        return reminded48h || reminded24h;
    }

    public CourtDate withReminded(ReminderWindow window) {
        return switch (window) {
            case HOURS_48 -> new CourtDate(date, description, true, reminded24h);
            case HOURS_24 -> new CourtDate(date, description, reminded48h, true);
        };
    }
}
