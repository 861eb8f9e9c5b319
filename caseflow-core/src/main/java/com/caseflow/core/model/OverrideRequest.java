package com.caseflow.core.model;

/**
 * A manual override received by signal and not yet applied by the loop.
 * stageId is the stage that was current when the signal arrived; null if none was yet.
 */
public record OverrideRequest(
    String stageId,
    String reason,
    String approvedBy
) {
}
