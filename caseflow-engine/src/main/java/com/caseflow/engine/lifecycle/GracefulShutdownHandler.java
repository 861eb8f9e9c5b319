package com.caseflow.engine.lifecycle;

import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.engine.runtime.WorkflowRunner;
import com.caseflow.scheduler.WakeupScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the orchestrator.
 *
 * On shutdown:
 * 1. Stops firing wakeups
 * 2. Waits for running iterations to finish (with timeout)
 * 3. Saves a snapshot of every live instance
 * 4. Stops the activity pool
 *
 * Anything interrupted here is resumed from history on the next start.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final WakeupScheduler scheduler;
    private final WorkflowDispatcher dispatcher;
    private final ExecutorService loopPool;
    private final ExecutorService activityPool;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(
            WakeupScheduler scheduler,
            WorkflowDispatcher dispatcher,
            @Qualifier("caseflowLoopPool") ExecutorService loopPool,
            @Qualifier("caseflowActivityPool") ExecutorService activityPool) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.loopPool = loopPool;
        this.activityPool = activityPool;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown with {} live workflows", dispatcher.activeCount());

        scheduler.stop();
        awaitTermination("loop", loopPool);

        int saved = 0;
        for (WorkflowRunner runner : dispatcher.runners()) {
            try {
                runner.saveSnapshot();
                saved++;
            } catch (RuntimeException e) {
                log.error("Failed to snapshot workflow {} on shutdown", runner.workflowId(), e);
            }
        }
        dispatcher.clear();

        awaitTermination("activity", activityPool);
        log.info("Graceful shutdown complete, {} snapshots saved", saved);
    }

    private void awaitTermination(String name, ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Timed out waiting for {} pool, interrupting remaining work", name);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
