package com.caseflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the workflow and entity they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forWorkflow(workflowId, entityId)) {
 *     ctx.stage(stageId);
 *     log.info("Entering stage"); // includes workflowId, entityId, stageId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2026-01-15 10:30:45.123 [caseflow-loop-1] INFO  c.c.e.r.WorkflowRunner - Entered stage review
 *   workflowId=case-42-lifecycle entityId=case-42 stageId=review traceId=1f2e3d4c
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String ENTITY_ID = "entityId";
    public static final String STAGE_ID = "stageId";
    public static final String SIGNAL = "signal";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one workflow instance.
     */
    public static LoggingContext forWorkflow(String workflowId, String entityId) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            MDC.put(WORKFLOW_ID, workflowId);
        }
        if (entityId != null) {
            MDC.put(ENTITY_ID, entityId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for signal delivery.
     */
    public static LoggingContext forSignal(String workflowId, String signal) {
        LoggingContext ctx = forWorkflow(workflowId, null);
        if (signal != null) {
            MDC.put(SIGNAL, signal);
        }
        return ctx;
    }

    /**
     * Set the current stage for the rest of this context.
     */
    public LoggingContext stage(String stageId) {
        if (stageId != null) {
            MDC.put(STAGE_ID, stageId);
        } else {
            MDC.remove(STAGE_ID);
        }
        return this;
    }

    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(ENTITY_ID);
        MDC.remove(STAGE_ID);
        MDC.remove(SIGNAL);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or loop iteration.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
