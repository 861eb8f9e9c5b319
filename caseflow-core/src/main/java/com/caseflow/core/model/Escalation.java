package com.caseflow.core.model;

import java.time.Instant;

/**
 * An issue raised to someone outside the normal stage flow.
 * escalatedTo is null for escalations raised by a stage timeout.
 */
public record Escalation(
    String stageId,
    String reason,
    String escalatedTo,
    EscalationSource source,
    Instant raisedAt
) {
}
