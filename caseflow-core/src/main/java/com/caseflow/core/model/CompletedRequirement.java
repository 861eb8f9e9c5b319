package com.caseflow.core.model;

import java.time.Instant;

/**
 * A requirement completed while a given stage was current.
 * The same requirement id completed in a later stage is a separate fact.
 */
public record CompletedRequirement(
    String requirementId,
    String stageId,
    Instant completedAt,
    String notes
) {
}
