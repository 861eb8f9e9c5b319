package com.caseflow.recovery;

import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.engine.coordinator.WorkflowCoordinator;
import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.engine.runtime.WorkflowRehydrator;
import com.caseflow.engine.runtime.WorkflowRunner;
import com.caseflow.scheduler.WakeupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for continuing workflows after a restart.
 *
 * Responsibilities:
 * - Rebuild every active instance from its snapshot and event tail, and drive it again
 * - Checkpoint live instances periodically so recovery replays short tails
 * - Wake live instances that lost their wakeup
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private static final Duration STALL_CHECK_INTERVAL = Duration.ofMinutes(1);

    private final WorkflowInstanceRepository instanceRepository;
    private final WorkflowRehydrator rehydrator;
    private final WorkflowCoordinator coordinator;
    private final WorkflowDispatcher dispatcher;
    private final WakeupScheduler wakeupScheduler;
    private final Duration snapshotInterval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            WorkflowInstanceRepository instanceRepository,
            WorkflowRehydrator rehydrator,
            WorkflowCoordinator coordinator,
            WorkflowDispatcher dispatcher,
            WakeupScheduler wakeupScheduler,
            Duration snapshotInterval) {
        this.instanceRepository = instanceRepository;
        this.rehydrator = rehydrator;
        this.coordinator = coordinator;
        this.dispatcher = dispatcher;
        this.wakeupScheduler = wakeupScheduler;
        this.snapshotInterval = snapshotInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "caseflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Recover active instances, then start the periodic checks.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        log.info("Starting recovery engine");

        int recovered = recoverActiveWorkflows();
        log.info("Recovered {} active workflows", recovered);

        scheduler.scheduleWithFixedDelay(
            this::checkpointLiveWorkflows,
            snapshotInterval.toMillis(),
            snapshotInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        scheduler.scheduleWithFixedDelay(
            this::wakeStalledWorkflows,
            STALL_CHECK_INTERVAL.toSeconds(),
            STALL_CHECK_INTERVAL.toSeconds(),
            TimeUnit.SECONDS
        );
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Rebuild and adopt every instance whose snapshot is still active.
     *
     * @return Number of instances handed to a runner
     */
    public int recoverActiveWorkflows() {
        List<WorkflowInstance> active = instanceRepository.findActive();
        int recovered = 0;
        for (WorkflowInstance snapshot : active) {
            try {
                if (recover(snapshot)) {
                    recovered++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover workflow {}", snapshot.workflowId(), e);
            }
        }
        return recovered;
    }

    private boolean recover(WorkflowInstance snapshot) {
        Optional<WorkflowInstance> rebuilt = rehydrator.load(snapshot.instanceId());
        if (rebuilt.isEmpty()) {
            log.warn("Snapshot of {} has no history, skipping", snapshot.workflowId());
            return false;
        }
        WorkflowInstance state = rebuilt.get();
        if (state.isTerminal()) {
            // Finished after the last snapshot was taken.
            instanceRepository.save(state);
            log.info("Workflow {} already {}, snapshot refreshed", state.workflowId(), state.status());
            return false;
        }
        if (state.lastSequence() > snapshot.lastSequence()) {
            log.info("Workflow {} replayed {} events past its snapshot", state.workflowId(),
                state.lastSequence() - snapshot.lastSequence());
        }
        return coordinator.adopt(state);
    }

    /**
     * Record a checkpoint for every live instance.
     */
    void checkpointLiveWorkflows() {
        if (!running) return;

        for (WorkflowRunner runner : dispatcher.runners()) {
            try {
                runner.checkpoint();
            } catch (RuntimeException e) {
                log.error("Failed to checkpoint workflow {}", runner.workflowId(), e);
            }
        }
    }

    /**
     * Wake running instances that have no pending wakeup.
     */
    void wakeStalledWorkflows() {
        if (!running) return;

        for (WorkflowRunner runner : dispatcher.runners()) {
            WorkflowInstance state = runner.state();
            if (state.isTerminal() || state.paused()) {
                continue;
            }
            if (wakeupScheduler.nextWakeup(runner.instanceId()).isEmpty()) {
                log.warn("Workflow {} has no pending wakeup, waking it", runner.workflowId());
                dispatcher.wake(runner.instanceId());
            }
        }
    }
}
