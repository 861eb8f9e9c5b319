package com.caseflow.core.model;

import java.time.Instant;

/**
 * Audit entry for a stage completed by an approver instead of by its requirements.
 */
public record ManualOverride(
    String stageId,
    String reason,
    String approvedBy,
    Instant appliedAt
) {
}
