package com.caseflow.worker;

/**
 * Thrown when the calling thread is interrupted while an activity runs or waits to retry,
 * typically on shutdown. The call outcome is unknown and the workflow is not failed;
 * recovery repeats the call with the same idempotency key.
 */
public class ActivityInterruptedException extends RuntimeException {

    public ActivityInterruptedException(String activityName, InterruptedException cause) {
        super("Interrupted during activity " + activityName, cause);
    }
}
