package com.caseflow.core.query;

import java.util.List;

/**
 * Requirements of the current stage split into completed and pending.
 */
public record RequirementsView(
    String stageId,
    List<String> completed,
    List<String> pending
) {
    public RequirementsView {
        completed = completed == null ? List.of() : List.copyOf(completed);
        pending = pending == null ? List.of() : List.copyOf(pending);
    }
}
