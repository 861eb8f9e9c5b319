package com.caseflow.worker;

import java.time.Duration;

/**
 * Observer of activity attempts, used for metrics.
 */
public interface ActivityListener {

    ActivityListener NOOP = new ActivityListener() {
    };

    default void onSuccess(String activityName, int attempt, Duration duration) {
    }

    default void onRetry(String activityName, int attempt, String errorCode, Duration backoff) {
    }

    default void onFailure(String activityName, int attempts, String errorCode) {
    }
}
