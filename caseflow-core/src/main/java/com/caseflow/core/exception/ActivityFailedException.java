package com.caseflow.core.exception;

/**
 * Thrown when an activity fails with a non-retryable error or exhausts its attempts.
 * Aborts the workflow instance that called it.
 */
public class ActivityFailedException extends OrchestratorException {

    public static final String ERROR_CODE = "ACTIVITY_FAILED";

    private final String activityName;
    private final int attempts;
    private final String activityErrorCode;

    public ActivityFailedException(String activityName, int attempts, String activityErrorCode,
                                   String message, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Activity %s failed after %d attempt(s) [%s]: %s",
            activityName, attempts, activityErrorCode, message
        ), cause);
        this.activityName = activityName;
        this.attempts = attempts;
        this.activityErrorCode = activityErrorCode;
    }

    public String getActivityName() {
        return activityName;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getActivityErrorCode() {
        return activityErrorCode;
    }
}
