package com.caseflow.worker;

import com.caseflow.core.exception.ActivityFailedException;
import com.caseflow.core.model.ActivityOptions;
import com.caseflow.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs activity calls with a start-to-close timeout per attempt and retries
 * according to the call's {@link RetryPolicy}.
 *
 * A call ends in one of three ways:
 * - the result of a successful attempt
 * - {@link ActivityFailedException} when the failure is non-retryable or attempts are exhausted
 * - {@link ActivityInterruptedException} when the calling thread is interrupted
 */
public class ActivityExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActivityExecutor.class);

    private final ExecutorService activityPool;
    private final Sleeper sleeper;
    private final ActivityListener listener;

    public ActivityExecutor(ExecutorService activityPool) {
        this(activityPool, Sleeper.THREAD, ActivityListener.NOOP);
    }

    public ActivityExecutor(ExecutorService activityPool, Sleeper sleeper, ActivityListener listener) {
        this.activityPool = activityPool;
        this.sleeper = sleeper;
        this.listener = listener;
    }

    /**
     * Execute an activity call.
     *
     * @param context Call context; the attempt number is filled in per attempt
     * @param options Timeout and retry policy
     * @param call The activity invocation
     * @return The call result
     */
    public <T> T execute(ActivityContext context, ActivityOptions options, ActivityCall<T> call) {
        RetryPolicy policy = options.retryPolicy();
        String name = context.getActivityName();
        int attempt = 1;

        while (true) {
            ActivityContext attemptContext = context.withAttempt(attempt);
            long start = System.nanoTime();
            try (MDC.MDCCloseable a = MDC.putCloseable("activity", name);
                 MDC.MDCCloseable n = MDC.putCloseable("attempt", String.valueOf(attempt))) {

                T result = runAttempt(attemptContext, options.startToCloseTimeout(), call);
                listener.onSuccess(name, attempt, Duration.ofNanos(System.nanoTime() - start));
                log.debug("Activity {} succeeded on attempt {}", name, attempt);
                return result;

            } catch (ActivityException e) {
                boolean retry = e.isRetryable()
                    && policy.shouldRetry(e.getErrorCode())
                    && policy.hasMoreAttempts(attempt);

                if (!retry) {
                    listener.onFailure(name, attempt, e.getErrorCode());
                    log.error("Activity {} failed after {} attempt(s): {} - {}",
                        name, attempt, e.getErrorCode(), e.getMessage());
                    throw new ActivityFailedException(name, attempt, e.getErrorCode(), e.getMessage(), e);
                }

                Duration backoff = policy.computeBackoff(attempt);
                listener.onRetry(name, attempt, e.getErrorCode(), backoff);
                log.warn("Activity {} attempt {} failed ({} - {}), retrying in {}ms",
                    name, attempt, e.getErrorCode(), e.getMessage(), backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ActivityInterruptedException(name, ie);
                }
                attempt++;
            }
        }
    }

    private <T> T runAttempt(ActivityContext context, Duration timeout, ActivityCall<T> call)
            throws ActivityException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = activityPool.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.call(context);
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ActivityException(ActivityException.TIMEOUT,
                "No result within start-to-close timeout of " + timeout, e, true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActivityInterruptedException(context.getActivityName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActivityException activityException) {
                throw activityException;
            }
            if (cause instanceof ActivityInterruptedException interrupted) {
                throw interrupted;
            }
            throw new ActivityException(ActivityException.INTERNAL_ERROR,
                String.valueOf(cause), cause, true);
        }
    }

    /**
     * One activity invocation.
     */
    @FunctionalInterface
    public interface ActivityCall<T> {
        T call(ActivityContext context) throws ActivityException;
    }

    /**
     * Waits between attempts. Replaced in tests to avoid real sleeps.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
