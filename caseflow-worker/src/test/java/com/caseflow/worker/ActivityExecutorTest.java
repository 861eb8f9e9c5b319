package com.caseflow.worker;

import com.caseflow.core.exception.ActivityFailedException;
import com.caseflow.core.model.ActivityOptions;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ActivityExecutorTest {

    private ExecutorService pool;
    private List<Duration> sleeps;
    private ActivityExecutor executor;

    private final ActivityContext context = new ActivityContext(
        UUID.randomUUID(), "wf-1", EntityType.CASE, "enterStage", "wf-1:7:enterStage", 1);

    private final ActivityOptions options = new ActivityOptions(
        Duration.ofSeconds(5),
        RetryPolicy.builder()
            .maximumAttempts(3)
            .initialInterval(Duration.ofSeconds(10))
            .maximumInterval(Duration.ofMinutes(1))
            .jitterFactor(0.0)
            .build());

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        sleeps = new ArrayList<>();
        executor = new ActivityExecutor(pool, sleeps::add, ActivityListener.NOOP);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void successOnFirstAttempt_returnsResult() {
        String result = executor.execute(context, options, ctx -> "ok-" + ctx.getAttemptNumber());

        assertThat(result).isEqualTo("ok-1");
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Transient failures are retried with exponential backoff")
    void transientFailure_isRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(context, options, ctx -> {
            if (calls.incrementAndGet() < 3) {
                throw ActivityException.transient_("HTTP_503", "unavailable");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(10), Duration.ofSeconds(20));
    }

    @Test
    @DisplayName("Idempotency key stays the same across attempts")
    void retries_keepIdempotencyKey() {
        List<String> keys = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();

        executor.execute(context, options, ctx -> {
            keys.add(ctx.getIdempotencyKey() + "#" + ctx.getAttemptNumber());
            if (calls.incrementAndGet() == 1) {
                throw ActivityException.transient_("HTTP_500", "boom");
            }
            return null;
        });

        assertThat(keys).containsExactly("wf-1:7:enterStage#1", "wf-1:7:enterStage#2");
    }

    @Test
    void exhaustedAttempts_throwActivityFailed() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(context, options, ctx -> {
            calls.incrementAndGet();
            throw ActivityException.transient_("HTTP_503", "unavailable");
        }))
            .isInstanceOf(ActivityFailedException.class)
            .satisfies(e -> {
                ActivityFailedException failed = (ActivityFailedException) e;
                assertThat(failed.getAttempts()).isEqualTo(3);
                assertThat(failed.getActivityName()).isEqualTo("enterStage");
                assertThat(failed.getActivityErrorCode()).isEqualTo("HTTP_503");
            });
        assertThat(calls).hasValue(3);
    }

    @Test
    void permanentFailure_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(context, options, ctx -> {
            calls.incrementAndGet();
            throw ActivityException.permanent("TEMPLATE_NOT_FOUND", "missing");
        })).isInstanceOf(ActivityFailedException.class);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void nonRetryableErrorCode_isNotRetried() {
        ActivityOptions strict = new ActivityOptions(Duration.ofSeconds(5),
            RetryPolicy.builder().nonRetryableErrors(Set.of("HTTP_409")).build());
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(context, strict, ctx -> {
            calls.incrementAndGet();
            throw ActivityException.transient_("HTTP_409", "conflict");
        })).isInstanceOf(ActivityFailedException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("An attempt exceeding start-to-close timeout counts as a retryable failure")
    void timeout_isRetryable() {
        ActivityOptions fast = new ActivityOptions(Duration.ofMillis(100),
            RetryPolicy.builder().maximumAttempts(2).jitterFactor(0.0).build());
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(context, fast, ctx -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    new CountDownLatch(1).await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return "second";
        });

        assertThat(result).isEqualTo("second");
        assertThat(calls).hasValue(2);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void unexpectedException_isRetriedAsInternalError() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(context, options, ctx -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }))
            .isInstanceOf(ActivityFailedException.class)
            .extracting(e -> ((ActivityFailedException) e).getActivityErrorCode())
            .isEqualTo(ActivityException.INTERNAL_ERROR);

        assertThat(calls).hasValue(3);
    }

    @Test
    void listener_seesRetriesAndFailure() {
        List<String> seen = new ArrayList<>();
        ActivityExecutor observed = new ActivityExecutor(pool, d -> { }, new ActivityListener() {
            @Override
            public void onRetry(String activityName, int attempt, String errorCode, Duration backoff) {
                seen.add("retry:" + attempt);
            }

            @Override
            public void onFailure(String activityName, int attempts, String errorCode) {
                seen.add("failure:" + attempts);
            }
        });

        assertThatThrownBy(() -> observed.execute(context, options, ctx -> {
            throw ActivityException.transient_("HTTP_500", "boom");
        })).isInstanceOf(ActivityFailedException.class);

        assertThat(seen).containsExactly("retry:1", "retry:2", "failure:3");
    }
}
