package com.caseflow.worker;

/**
 * Exception thrown by activities on failure.
 * Retryable failures are retried by {@link ActivityExecutor}; the others fail the call at once.
 */
public class ActivityException extends Exception {

    public static final String TIMEOUT = "ACTIVITY_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String errorCode;
    private final boolean retryable;

    public ActivityException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public ActivityException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public ActivityException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ActivityException permanent(String errorCode, String message) {
        return new ActivityException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static ActivityException transient_(String errorCode, String message) {
        return new ActivityException(errorCode, message, true);
    }
}
