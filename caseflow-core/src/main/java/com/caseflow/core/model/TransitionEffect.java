package com.caseflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Side effects of a stage transition, in execution order.
 * Exit effects run against the stage being left, entry effects against the target.
 */
public enum TransitionEffect {
    EXIT_PERSIST,
    EXIT_NOTIFY,
    EXIT_LOG,
    ENTRY_PERSIST,
    ENTRY_NOTIFY,
    ENTRY_NOTIFY_TEAM,
    ENTRY_LOG;

    public boolean isExit() {
        return this == EXIT_PERSIST || this == EXIT_NOTIFY || this == EXIT_LOG;
    }

    /**
     * Effects required to move from {@code from} (null for the initial entry) to {@code to}.
     */
    public static List<TransitionEffect> plan(Stage from, Stage to) {
        List<TransitionEffect> effects = new ArrayList<>();
        if (from != null) {
            effects.add(EXIT_PERSIST);
            if (from.notifyOnExit()) {
                effects.add(EXIT_NOTIFY);
            }
            effects.add(EXIT_LOG);
        }
        effects.add(ENTRY_PERSIST);
        if (to.notifyOnEntry()) {
            effects.add(ENTRY_NOTIFY);
        }
        effects.add(ENTRY_NOTIFY_TEAM);
        effects.add(ENTRY_LOG);
        return List.copyOf(effects);
    }
}
