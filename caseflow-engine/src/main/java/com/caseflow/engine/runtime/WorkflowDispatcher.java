package com.caseflow.engine.runtime;

import com.caseflow.scheduler.WakeupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs runner iterations on the loop pool when their wakeups fire.
 *
 * At most one iteration per instance runs at a time. A wakeup that arrives while an
 * iteration is running is coalesced into one follow-up iteration.
 */
public class WorkflowDispatcher implements WakeupScheduler.WakeupCallback {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDispatcher.class);

    static final Duration ERROR_RETRY_DELAY = Duration.ofSeconds(30);

    private final Map<UUID, WorkflowRunner> runners = new ConcurrentHashMap<>();
    private final Map<UUID, Slot> slots = new ConcurrentHashMap<>();
    private final ExecutorService loopPool;
    private final Clock clock;
    private volatile WakeupScheduler scheduler;

    public WorkflowDispatcher(ExecutorService loopPool, Clock clock) {
        this.loopPool = loopPool;
        this.clock = clock;
    }

    /**
     * Bind the scheduler that fires this dispatcher. Called once during wiring.
     */
    public void bind(WakeupScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void register(WorkflowRunner runner) {
        runners.put(runner.instanceId(), runner);
    }

    public Optional<WorkflowRunner> runner(UUID instanceId) {
        return Optional.ofNullable(runners.get(instanceId));
    }

    public Collection<WorkflowRunner> runners() {
        return List.copyOf(runners.values());
    }

    public int activeCount() {
        return runners.size();
    }

    /**
     * Request an iteration as soon as possible.
     */
    public void wake(UUID instanceId) {
        scheduler.wakeNow(instanceId);
    }

    @Override
    public void onWakeup(UUID instanceId) {
        WorkflowRunner runner = runners.get(instanceId);
        if (runner == null) {
            log.debug("Wakeup for unknown or finished instance {}", instanceId);
            return;
        }
        Slot slot = slots.computeIfAbsent(instanceId, id -> new Slot());
        if (!slot.running.compareAndSet(false, true)) {
            slot.rerun.set(true);
            return;
        }
        submit(runner, slot);
    }

    private void submit(WorkflowRunner runner, Slot slot) {
        try {
            loopPool.execute(() -> iterate(runner, slot));
        } catch (RejectedExecutionException e) {
            slot.running.set(false);
            log.warn("Loop pool rejected iteration of {}, retrying in {}: {}",
                runner.workflowId(), ERROR_RETRY_DELAY, e.getMessage());
            scheduler.schedule(runner.instanceId(), clock.instant().plus(ERROR_RETRY_DELAY));
        }
    }

    private void iterate(WorkflowRunner runner, Slot slot) {
        UUID instanceId = runner.instanceId();
        try {
            slot.rerun.set(false);
            Optional<Instant> next = runner.runIteration();
            if (runner.isFinished()) {
                runners.remove(instanceId);
                slots.remove(instanceId);
                scheduler.cancel(instanceId);
                log.debug("Runner for {} finished", runner.workflowId());
            } else if (next.isPresent()) {
                scheduler.schedule(instanceId, next.get());
            } else {
                scheduler.cancel(instanceId);
            }
        } catch (RuntimeException e) {
            // The runner fails the instance itself on anything but store errors.
            log.error("Store error in iteration of {}, retrying in {}", runner.workflowId(), ERROR_RETRY_DELAY, e);
            scheduler.schedule(instanceId, clock.instant().plus(ERROR_RETRY_DELAY));
        } finally {
            slot.running.set(false);
            if (slot.rerun.getAndSet(false) && runners.containsKey(instanceId)
                && slot.running.compareAndSet(false, true)) {
                submit(runner, slot);
            }
        }
    }

    /**
     * Forget every runner without touching history. Used on shutdown.
     */
    public void clear() {
        runners.clear();
        slots.clear();
    }

    private static final class Slot {
        private final AtomicBoolean running = new AtomicBoolean();
        private final AtomicBoolean rerun = new AtomicBoolean();
    }
}
