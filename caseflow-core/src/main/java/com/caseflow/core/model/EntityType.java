package com.caseflow.core.model;

/**
 * Kind of business record a workflow instance governs.
 */
public enum EntityType {
    /**
     * A legal case moving through litigation stages.
     */
    CASE,

    /**
     * An employee lifecycle process, e.g. offboarding.
     */
    EMPLOYEE
}
