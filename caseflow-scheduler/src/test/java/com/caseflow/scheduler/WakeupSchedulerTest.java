package com.caseflow.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class WakeupSchedulerTest {

    private final List<UUID> woken = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstWakeup = new CountDownLatch(1);
    private WakeupScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new WakeupScheduler(Clock.systemUTC(), id -> {
            woken.add(id);
            firstWakeup.countDown();
        });
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void wakeNow_firesImmediately() throws InterruptedException {
        UUID id = UUID.randomUUID();

        scheduler.wakeNow(id);

        assertThat(firstWakeup.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(woken).containsExactly(id);
        assertThat(scheduler.nextWakeup(id)).isEmpty();
    }

    @Test
    void rescheduling_replacesPendingWakeup() throws InterruptedException {
        UUID id = UUID.randomUUID();

        scheduler.schedule(id, Instant.now().plus(Duration.ofHours(1)));
        scheduler.schedule(id, Instant.now().plus(Duration.ofMillis(50)));

        assertThat(firstWakeup.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(woken).containsExactly(id);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void cancel_dropsPendingWakeup() throws InterruptedException {
        UUID id = UUID.randomUUID();
        scheduler.schedule(id, Instant.now().plus(Duration.ofMillis(100)));

        assertThat(scheduler.cancel(id)).isTrue();

        assertThat(firstWakeup.await(300, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(woken).isEmpty();
        assertThat(scheduler.cancel(id)).isFalse();
    }

    @Test
    void nextWakeup_reportsFireTime() {
        UUID id = UUID.randomUUID();
        Instant at = Instant.now().plus(Duration.ofHours(2));

        scheduler.schedule(id, at);

        assertThat(scheduler.nextWakeup(id)).contains(at);
    }
}
