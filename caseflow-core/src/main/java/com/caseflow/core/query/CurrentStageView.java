package com.caseflow.core.query;

import com.caseflow.core.model.Stage;

import java.time.Instant;

/**
 * Answer of the current-stage query. All fields are null before the initial stage is entered.
 */
public record CurrentStageView(
    Stage stage,
    String stageId,
    Instant enteredAt
) {
}
