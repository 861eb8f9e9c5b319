package com.caseflow.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behavior of one activity call.
 * Immutable and shared by all calls made with the same {@link ActivityOptions}.
 *
 * Invariants:
 * - maximumAttempts >= 1
 * - initialInterval >= 0
 * - maximumInterval >= initialInterval
 * - backoffCoefficient >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maximumAttempts,
    Duration initialInterval,
    Duration maximumInterval,
    double backoffCoefficient,
    double jitterFactor,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maximumAttempts < 1) {
            throw new IllegalArgumentException("maximumAttempts must be >= 1");
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        if (maximumInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maximumInterval must be >= initialInterval");
        }
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Default activity policy: 3 attempts, 10s doubling up to 1m.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(10),
            Duration.ofMinutes(1),
            2.0,
            0.1,
            Set.of()
        );
    }

    /**
     * Policy for long-running back-office activities: 3 attempts, 30s doubling up to 10m.
     */
    public static RetryPolicy patient() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(30),
            Duration.ofMinutes(10),
            2.0,
            0.1,
            Set.of()
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(
            1,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            Set.of()
        );
    }

    /**
     * Compute the backoff to wait after a failed attempt.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // initialInterval * (coefficient ^ (attempt - 1))
        double baseMs = initialInterval.toMillis() *
            Math.pow(backoffCoefficient, attemptNumber - 1);

        double cappedMs = Math.min(baseMs, maximumInterval.toMillis());

        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange +
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredMs);
    }

    /**
     * Check if the given error code may be retried.
     *
     * @param errorCode Error code reported by the activity
     * @return false if the code is listed as non-retryable
     */
    public boolean shouldRetry(String errorCode) {
        return !nonRetryableErrors.contains(errorCode);
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maximumAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maximumAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(10);
        private Duration maximumInterval = Duration.ofMinutes(1);
        private double backoffCoefficient = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maximumAttempts(int maximumAttempts) {
            this.maximumAttempts = maximumAttempts;
            return this;
        }

        public Builder initialInterval(Duration initialInterval) {
            this.initialInterval = initialInterval;
            return this;
        }

        public Builder maximumInterval(Duration maximumInterval) {
            this.maximumInterval = maximumInterval;
            return this;
        }

        public Builder backoffCoefficient(double backoffCoefficient) {
            this.backoffCoefficient = backoffCoefficient;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maximumAttempts, initialInterval, maximumInterval,
                backoffCoefficient, jitterFactor, nonRetryableErrors
            );
        }
    }
}
