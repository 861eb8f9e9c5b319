package com.caseflow.engine.metrics;

import com.caseflow.core.model.Event;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.engine.runtime.WorkflowEventListener;
import com.caseflow.worker.ActivityListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Prometheus metrics for lifecycle workflows.
 *
 * Metrics exposed:
 * - Workflow outcomes by template
 * - Stage transitions by target stage
 * - Reminders sent by kind
 * - Escalations and manual overrides
 * - Activity durations, retries and failures
 *
 * Fed by the runner's event stream and by the activity executor.
 */
public class WorkflowMetrics implements MeterBinder, WorkflowEventListener, ActivityListener {

    // Metric names
    public static final String WORKFLOW_STARTED = "caseflow.workflows.started";
    public static final String WORKFLOW_COMPLETED = "caseflow.workflows.completed";
    public static final String WORKFLOW_FAILED = "caseflow.workflows.failed";
    public static final String WORKFLOW_CANCELLED = "caseflow.workflows.cancelled";
    public static final String WORKFLOW_DURATION = "caseflow.workflow.duration";

    public static final String STAGE_TRANSITIONS = "caseflow.stage.transitions";
    public static final String TRANSITIONS_REJECTED = "caseflow.stage.transitions.rejected";
    public static final String REMINDERS_SENT = "caseflow.reminders.sent";
    public static final String ESCALATIONS = "caseflow.escalations";
    public static final String MANUAL_OVERRIDES = "caseflow.stage.overrides";

    public static final String ACTIVITY_DURATION = "caseflow.activity.duration";
    public static final String ACTIVITY_RETRIES = "caseflow.activity.retries";
    public static final String ACTIVITY_FAILURES = "caseflow.activity.failures";

    private volatile MeterRegistry registry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Workflow Metrics ==========

    @Override
    public void onEvent(WorkflowInstance state, Event event) {
        MeterRegistry meters = registry;
        if (meters == null) {
            return;
        }
        String template = state.templateId() != null ? state.templateId() : "unknown";
        switch (event.type()) {
            case WORKFLOW_STARTED -> counter(meters, WORKFLOW_STARTED, "Total workflows started",
                "template", template).increment();
            case WORKFLOW_COMPLETED -> {
                counter(meters, WORKFLOW_COMPLETED, "Total workflows completed", "template", template).increment();
                if (state.startedAt() != null && state.completedAt() != null) {
                    Timer.builder(WORKFLOW_DURATION)
                        .tag("template", template)
                        .description("Time from start to completion")
                        .register(meters)
                        .record(Duration.between(state.startedAt(), state.completedAt()));
                }
            }
            case WORKFLOW_FAILED -> counter(meters, WORKFLOW_FAILED, "Total workflows failed",
                "template", template).increment();
            case WORKFLOW_CANCELLED -> counter(meters, WORKFLOW_CANCELLED, "Total workflows cancelled",
                "template", template).increment();
            case STAGE_ENTERED -> counter(meters, STAGE_TRANSITIONS, "Stages entered",
                "stage", String.valueOf(state.currentStageId())).increment();
            case TRANSITION_REJECTED -> counter(meters, TRANSITIONS_REJECTED, "Transitions to unknown stages",
                "template", template).increment();
            case DEADLINE_REMINDER_SENT, DEADLINE_OVERDUE_NOTIFIED, COURT_DATE_REMINDER_SENT ->
                counter(meters, REMINDERS_SENT, "Reminders sent", "kind", event.type().name()).increment();
            case ESCALATION_RAISED, STAGE_TIMEOUT_ESCALATED ->
                counter(meters, ESCALATIONS, "Escalations raised", "kind", event.type().name()).increment();
            case MANUAL_OVERRIDE_APPLIED -> counter(meters, MANUAL_OVERRIDES, "Stages completed by manual override",
                "template", template).increment();
            default -> {
                // not measured
            }
        }
    }

    // ========== Activity Metrics ==========

    @Override
    public void onSuccess(String activityName, int attempt, Duration duration) {
        MeterRegistry meters = registry;
        if (meters == null) {
            return;
        }
        Timer.builder(ACTIVITY_DURATION)
            .tag("activity", activityName)
            .tag("outcome", "success")
            .description("Activity execution duration")
            .register(meters)
            .record(duration);
    }

    @Override
    public void onRetry(String activityName, int attempt, String errorCode, Duration backoff) {
        MeterRegistry meters = registry;
        if (meters == null) {
            return;
        }
        Counter.builder(ACTIVITY_RETRIES)
            .tag("activity", activityName)
            .tag("error_code", errorCode)
            .description("Activity attempts that will be retried")
            .register(meters)
            .increment();
    }

    @Override
    public void onFailure(String activityName, int attempts, String errorCode) {
        MeterRegistry meters = registry;
        if (meters == null) {
            return;
        }
        Counter.builder(ACTIVITY_FAILURES)
            .tag("activity", activityName)
            .tag("error_code", errorCode)
            .description("Activities failed after their last attempt")
            .register(meters)
            .increment();
    }

    private static Counter counter(MeterRegistry meters, String name, String description, String tag, String value) {
        return Counter.builder(name)
            .tag(tag, value)
            .description(description)
            .register(meters);
    }
}
