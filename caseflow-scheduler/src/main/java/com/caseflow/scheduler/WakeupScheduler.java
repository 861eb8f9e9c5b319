package com.caseflow.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delayed wakeups keyed by workflow instance.
 *
 * Each instance has at most one pending wakeup. Scheduling again replaces it,
 * so the owner always decides the next wakeup from its latest state:
 * the earlier of its poll interval and its next reminder threshold.
 * Signals call {@link #wakeNow(UUID)}.
 *
 * The callback runs on the scheduler thread and must hand work off quickly.
 */
public class WakeupScheduler {

    private static final Logger log = LoggerFactory.getLogger(WakeupScheduler.class);

    private final Clock clock;
    private final WakeupCallback callback;
    private final ScheduledExecutorService scheduler;
    private final Map<UUID, PendingWakeup> pending = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public WakeupScheduler(Clock clock, WakeupCallback callback) {
        this.clock = clock;
        this.callback = callback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "caseflow-wakeup");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Wakeup scheduler already running");
            return;
        }
        running = true;
        log.info("Wakeup scheduler started");
    }

    /**
     * Stop the scheduler. Pending wakeups are dropped; recovery reschedules them.
     */
    public void stop() {
        running = false;
        pending.values().forEach(p -> p.future().cancel(false));
        pending.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Wakeup scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedule the next wakeup of an instance, replacing any pending one.
     *
     * @param instanceId The workflow instance
     * @param fireAt When to wake it; past instants fire immediately
     */
    public void schedule(UUID instanceId, Instant fireAt) {
        if (!running) {
            log.debug("Ignoring wakeup for {} while stopped", instanceId);
            return;
        }
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        pending.compute(instanceId, (id, previous) -> {
            if (previous != null) {
                previous.future().cancel(false);
            }
            ScheduledFuture<?> future = scheduler.schedule(() -> fire(id, fireAt), delayMs, TimeUnit.MILLISECONDS);
            return new PendingWakeup(fireAt, future);
        });
        log.debug("Wakeup for {} scheduled at {}", instanceId, fireAt);
    }

    /**
     * Wake an instance as soon as possible.
     */
    public void wakeNow(UUID instanceId) {
        schedule(instanceId, clock.instant());
    }

    /**
     * Drop the pending wakeup of an instance, e.g. when it terminates or pauses.
     *
     * @return true if a wakeup was pending
     */
    public boolean cancel(UUID instanceId) {
        PendingWakeup removed = pending.remove(instanceId);
        if (removed != null) {
            removed.future().cancel(false);
            return true;
        }
        return false;
    }

    public Optional<Instant> nextWakeup(UUID instanceId) {
        return Optional.ofNullable(pending.get(instanceId)).map(PendingWakeup::fireAt);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void fire(UUID instanceId, Instant fireAt) {
        // Keep a wakeup that replaced this one
        pending.computeIfPresent(instanceId, (id, p) -> p.fireAt().equals(fireAt) ? null : p);
        try {
            callback.onWakeup(instanceId);
        } catch (RuntimeException e) {
            log.error("Wakeup callback failed for {}", instanceId, e);
        }
    }

    /**
     * Callback invoked when an instance's wakeup is due.
     */
    @FunctionalInterface
    public interface WakeupCallback {
        void onWakeup(UUID instanceId);
    }

    private record PendingWakeup(Instant fireAt, ScheduledFuture<?> future) {
    }
}
