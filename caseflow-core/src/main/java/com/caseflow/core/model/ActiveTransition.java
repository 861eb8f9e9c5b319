package com.caseflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A transition the loop has started but not finished.
 * completedEffects is a prefix of {@link TransitionEffect#plan(Stage, Stage)},
 * which lets a restarted loop skip effects that already ran.
 * startedSequence is the sequence number of the TRANSITION_STARTED event.
 */
public record ActiveTransition(
    long startedSequence,
    String fromStageId,
    String toStageId,
    TransitionReason reason,
    String notes,
    List<TransitionEffect> completedEffects
) {
    public ActiveTransition {
        completedEffects = completedEffects == null ? List.of() : List.copyOf(completedEffects);
    }

    public ActiveTransition withEffectCompleted(TransitionEffect effect) {
        List<TransitionEffect> effects = new ArrayList<>(completedEffects);
        effects.add(effect);
        return new ActiveTransition(startedSequence, fromStageId, toStageId, reason, notes, effects);
    }

    public boolean isCompleted(TransitionEffect effect) {
        return completedEffects.contains(effect);
    }
}
