package com.caseflow.core.model;

import java.time.Duration;

/**
 * Per-call limits of an activity: a start-to-close timeout for each attempt
 * and the retry policy across attempts.
 */
public record ActivityOptions(
    Duration startToCloseTimeout,
    RetryPolicy retryPolicy
) {
    public static final Duration DEFAULT_START_TO_CLOSE = Duration.ofMinutes(5);

    public ActivityOptions {
        if (startToCloseTimeout == null || startToCloseTimeout.isNegative() || startToCloseTimeout.isZero()) {
            throw new IllegalArgumentException("startToCloseTimeout must be positive");
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
    }

    public static ActivityOptions defaults() {
        return new ActivityOptions(DEFAULT_START_TO_CLOSE, RetryPolicy.defaultPolicy());
    }
}
