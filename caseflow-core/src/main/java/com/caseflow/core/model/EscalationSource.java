package com.caseflow.core.model;

public enum EscalationSource {
    SIGNAL,
    STAGE_TIMEOUT
}
