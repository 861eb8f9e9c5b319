package com.caseflow.core.model;

/**
 * A pending request to move to another stage, not yet picked up by the loop.
 */
public record TransitionRequest(
    String targetStageId,
    TransitionReason reason,
    String notes
) {
}
