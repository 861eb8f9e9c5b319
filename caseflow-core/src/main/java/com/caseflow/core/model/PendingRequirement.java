package com.caseflow.core.model;

/**
 * A requirement completion received by signal and not yet applied by the loop.
 */
public record PendingRequirement(
    String requirementId,
    String notes
) {
}
