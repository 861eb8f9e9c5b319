package com.caseflow.worker;

import java.util.Collection;
import java.util.List;

/**
 * Result of checking a stage's requirements against the completed ones.
 */
public record RequirementCheck(
    boolean satisfied,
    List<String> pending
) {
    public RequirementCheck {
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    public static RequirementCheck of(List<String> required, Collection<String> completed) {
        List<String> pending = required.stream()
            .filter(r -> !completed.contains(r))
            .toList();
        return new RequirementCheck(pending.isEmpty(), pending);
    }
}
