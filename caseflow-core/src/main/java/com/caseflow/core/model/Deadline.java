package com.caseflow.core.model;

import java.time.Instant;

/**
 * A dated obligation attached to a running instance.
 * Both flags are monotonic: once set they are never cleared.
 */
public record Deadline(
    Instant date,
    String description,
    boolean reminded,
    boolean overdueNotified
) {
    public static Deadline of(Instant date, String description) {
        return new Deadline(date, description, false, false);
    }

    public Deadline withReminded() {
        return new Deadline(date, description, true, overdueNotified);
    }

    public Deadline withOverdueNotified() {
        return new Deadline(date, description, reminded, true);
    }
}
