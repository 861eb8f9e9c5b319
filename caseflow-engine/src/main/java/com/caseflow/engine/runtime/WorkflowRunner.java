package com.caseflow.engine.runtime;

import com.caseflow.core.exception.ActivityFailedException;
import com.caseflow.core.exception.InvalidStateTransitionException;
import com.caseflow.core.exception.OptimisticLockException;
import com.caseflow.core.exception.OrchestratorException;
import com.caseflow.core.exception.WorkflowExecutionException;
import com.caseflow.core.exception.WorkflowValidationException;
import com.caseflow.core.model.ActiveTransition;
import com.caseflow.core.model.CompletedRequirement;
import com.caseflow.core.model.CourtDate;
import com.caseflow.core.model.Deadline;
import com.caseflow.core.model.DeadlineNotice;
import com.caseflow.core.model.EntityType;
import com.caseflow.core.model.Event;
import com.caseflow.core.model.EventType;
import com.caseflow.core.model.OverrideRequest;
import com.caseflow.core.model.PendingRequirement;
import com.caseflow.core.model.Stage;
import com.caseflow.core.model.TransitionEffect;
import com.caseflow.core.model.TransitionRequest;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowTemplate;
import com.caseflow.core.query.WorkflowResult;
import com.caseflow.core.reducer.EventPayloads;
import com.caseflow.core.reducer.WorkflowStateReducer;
import com.caseflow.core.reminder.CourtDateReminder;
import com.caseflow.core.reminder.DeadlineReminder;
import com.caseflow.core.reminder.ReminderPolicy;
import com.caseflow.core.signal.WorkflowSignal;
import com.caseflow.engine.logging.LoggingContext;
import com.caseflow.worker.ActivityContext;
import com.caseflow.worker.ActivityException;
import com.caseflow.worker.ActivityExecutor;
import com.caseflow.worker.ActivityInterruptedException;
import com.caseflow.worker.LifecycleActivities;
import com.caseflow.worker.RequirementCheck;
import com.caseflow.worker.TransitionDirection;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one workflow instance from its initial stage to a terminal stage.
 *
 * Every state change is an event appended to the instance's history and applied
 * with {@link WorkflowStateReducer}; appends happen under {@link #lock}, activities
 * run outside it so signals never wait for an activity.
 *
 * Iteration order:
 * 1. load and validate the template, once
 * 2. stop if paused (rechecked before every later step)
 * 3. finish a transition interrupted by a crash
 * 4. drain added deadlines and court dates
 * 5. apply one requirement completion and check the stage's requirements
 * 6. apply a manual override of the current stage
 * 7. run the pending transition, explicit, automatic or by override
 * 8. send due reminders
 * 9. escalate once if the current stage ran past its timeout
 * 10. finalize if the current stage is terminal, otherwise report the next wakeup
 *
 * Iterations of one runner must not overlap; {@link WorkflowDispatcher} serializes them.
 */
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private final UUID instanceId;
    private final RunnerEnvironment env;
    private final LifecycleActivities activities;
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<WorkflowResult> result = new CompletableFuture<>();

    private volatile WorkflowInstance state;

    private WorkflowRunner(WorkflowInstance state, RunnerEnvironment env) {
        this.instanceId = state.instanceId();
        this.state = state;
        this.env = env;
        this.activities = env.activities();
        if (state.isTerminal()) {
            settleResult(state, null);
        }
    }

    /**
     * Create a new instance by recording WORKFLOW_STARTED.
     */
    public static WorkflowRunner start(
            UUID instanceId,
            String workflowId,
            String entityId,
            EntityType entityType,
            String templateId,
            JsonNode input,
            RunnerEnvironment env) {
        WorkflowRunner runner = new WorkflowRunner(WorkflowInstance.empty(instanceId), env);
        runner.record(EventType.WORKFLOW_STARTED,
            EventPayloads.workflowStarted(workflowId, entityId, entityType, templateId, input),
            Event.ACTOR_USER, "start");
        runner.saveSnapshot();
        log.info("Started workflow {} for {} {} with template {}", workflowId, entityType, entityId, templateId);
        return runner;
    }

    /**
     * Continue an instance from a state rebuilt from history.
     */
    public static WorkflowRunner resume(WorkflowInstance state, RunnerEnvironment env) {
        return new WorkflowRunner(state, env);
    }

    public UUID instanceId() {
        return instanceId;
    }

    public String workflowId() {
        return state.workflowId();
    }

    /**
     * Latest state. Safe to call from any thread; never blocks.
     */
    public WorkflowInstance state() {
        return state;
    }

    public boolean isFinished() {
        return state.isTerminal();
    }

    /**
     * Completes with the final state, or exceptionally with
     * {@link WorkflowExecutionException} if the instance failed or was cancelled.
     */
    public CompletableFuture<WorkflowResult> result() {
        return result;
    }

    // ========== Signals ==========

    /**
     * Record a signal. Queued signals are applied by the next iteration;
     * pause, resume, escalate and cancel take effect immediately.
     *
     * @return The state after the signal was recorded
     * @throws InvalidStateTransitionException if the instance already terminated
     */
    public WorkflowInstance signal(WorkflowSignal signal) {
        lock.lock();
        try {
            WorkflowInstance current = state;
            if (current.isTerminal()) {
                throw new InvalidStateTransitionException(current.workflowId(), current.status(), signal.type().name());
            }
            String actorId = signal.type().name();
            switch (signal.type()) {
                case PAUSE -> {
                    if (!current.paused()) {
                        record(EventType.WORKFLOW_PAUSED, EventPayloads.empty(), Event.ACTOR_SIGNAL, actorId);
                        log.info("Workflow {} paused", current.workflowId());
                    }
                }
                case RESUME -> {
                    if (current.paused()) {
                        record(EventType.WORKFLOW_RESUMED, EventPayloads.empty(), Event.ACTOR_SIGNAL, actorId);
                        log.info("Workflow {} resumed", current.workflowId());
                    }
                }
                case ESCALATE -> {
                    record(EventType.ESCALATION_RAISED, EventPayloads.escalationRaised(
                        current.currentStageId(), signal.notes(), signal.escalatedTo()), Event.ACTOR_SIGNAL, actorId);
                    log.warn("Workflow {} escalated to {} in stage {}: {}", current.workflowId(),
                        signal.escalatedTo(), current.currentStageId(), signal.notes());
                }
                case CANCEL -> {
                    WorkflowInstance cancelled = record(EventType.WORKFLOW_CANCELLED,
                        EventPayloads.cancelled(signal.notes()), Event.ACTOR_SIGNAL, actorId);
                    log.info("Workflow {} cancelled in stage {}", current.workflowId(), current.currentStageId());
                    settleResult(cancelled, null);
                }
                default -> record(EventType.SIGNAL_RECEIVED, EventPayloads.signalReceived(signal),
                    Event.ACTOR_SIGNAL, actorId);
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    // ========== Loop ==========

    /**
     * Run one iteration of the loop.
     *
     * @return When to run the next iteration; empty if the instance is paused,
     *         terminated or was interrupted
     */
    public Optional<Instant> runIteration() {
        WorkflowInstance current = state;
        try (LoggingContext ctx = LoggingContext.forWorkflow(current.workflowId(), current.entityId())) {
            ctx.stage(current.currentStageId());
            try {
                Optional<Instant> next = iterate();
                saveSnapshot();
                return next;
            } catch (InstanceStoppedException e) {
                log.info("Workflow {} stopped during iteration: {}", current.workflowId(), e.getMessage());
                saveSnapshot();
                return Optional.empty();
            } catch (ActivityInterruptedException e) {
                log.info("Iteration of workflow {} interrupted, history is kept for recovery", current.workflowId());
                return Optional.empty();
            } catch (ActivityFailedException | WorkflowValidationException e) {
                fail(e);
                saveSnapshot();
                return Optional.empty();
            } catch (OptimisticLockException | DataAccessException e) {
                // Store trouble; the dispatcher retries the iteration later.
                throw e;
            } catch (RuntimeException e) {
                fail(new OrchestratorException(UNEXPECTED_ERROR,
                    "Unexpected " + e.getClass().getSimpleName() + " in workflow loop: " + e.getMessage(), e));
                saveSnapshot();
                return Optional.empty();
            }
        }
    }

    private Optional<Instant> iterate() {
        if (state.isTerminal()) {
            settleResult(state, null);
            return Optional.empty();
        }
        if (state.paused()) {
            log.debug("Workflow {} is paused", state.workflowId());
            return Optional.empty();
        }
        if (!state.isTemplateLoaded()) {
            loadTemplate();
        }

        if (state.activeTransition() != null && !state.paused()) {
            continueTransition();
        }
        if (state.paused()) {
            return Optional.empty();
        }

        drainDatedSignals();
        if (state.paused()) {
            return Optional.empty();
        }

        processRequirement();
        if (state.paused()) {
            return Optional.empty();
        }

        processOverride();
        if (state.paused()) {
            return Optional.empty();
        }

        TransitionRequest request = state.pendingTransition();
        if (request != null) {
            transition(request);
        }
        if (state.paused()) {
            return Optional.empty();
        }

        checkReminders();
        if (state.paused()) {
            return Optional.empty();
        }

        checkStageTimeout();
        if (state.paused()) {
            return Optional.empty();
        }

        if (state.currentStage().map(Stage::terminal).orElse(false)) {
            finish();
            return Optional.empty();
        }
        return Optional.of(nextWakeup());
    }

    private void loadTemplate() {
        String templateId = state.templateId();
        WorkflowTemplate template = call("getWorkflowTemplate", "template",
            ctx -> activities.getWorkflowTemplate(ctx, templateId));
        template.validate();
        loopRecord(EventType.TEMPLATE_LOADED, EventPayloads.templateLoaded(template));
        log.info("Loaded template {} v{} with {} stages", template.templateId(), template.version(),
            template.stages().size());
    }

    private void drainDatedSignals() {
        while (!state.pendingDeadlines().isEmpty()) {
            Deadline deadline = state.pendingDeadlines().get(0);
            loopRecord(EventType.DEADLINE_ADDED, EventPayloads.dated(deadline.date(), deadline.description()));
            log.info("Deadline added: '{}' due {}", deadline.description(), deadline.date());
        }
        while (!state.pendingCourtDates().isEmpty()) {
            CourtDate courtDate = state.pendingCourtDates().get(0);
            loopRecord(EventType.COURT_DATE_ADDED, EventPayloads.dated(courtDate.date(), courtDate.description()));
            log.info("Court date added: '{}' on {}", courtDate.description(), courtDate.date());
        }
    }

    /**
     * Apply one pending requirement completion, or finish a check interrupted by a crash.
     */
    private void processRequirement() {
        if (state.currentStageId() == null) {
            return;
        }
        if (state.requirementCheckStageId() == null) {
            if (state.pendingRequirements().isEmpty()) {
                return;
            }
            PendingRequirement next = state.pendingRequirements().get(0);
            loopRecord(EventType.REQUIREMENT_COMPLETED,
                EventPayloads.requirementCompleted(next.requirementId(), state.currentStageId(), next.notes()));
        }

        WorkflowInstance current = state;
        String stageId = current.requirementCheckStageId();
        Stage stage = current.findStage(stageId)
            .orElseThrow(() -> new IllegalStateException("Unknown stage in requirement check: " + stageId));
        List<CompletedRequirement> all = current.completedRequirements();
        CompletedRequirement completed = all.get(all.size() - 1);
        Set<String> completedIds = Set.copyOf(current.completedRequirementIds(stageId));
        String key = "requirement:" + stageId + ":" + all.size();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requirementId", completed.requirementId());
        details.put("stageId", stageId);
        details.put("stageName", stage.name());
        details.put("notes", completed.notes());
        run("logCaseActivity", key + ":requirement_completed",
            ctx -> activities.logCaseActivity(ctx, current.entityId(), "requirement_completed", details));

        RequirementCheck check = call("checkStageRequirements", key,
            ctx -> activities.checkStageRequirements(ctx, current.entityId(), stage, completedIds));
        loopRecord(EventType.REQUIREMENTS_CHECKED,
            EventPayloads.requirementsChecked(stageId, check.satisfied(), check.pending()));

        log.info("Requirement {} completed in stage {}, satisfied={}, pending={}",
            completed.requirementId(), stageId, check.satisfied(), check.pending());
    }

    /**
     * Apply a pending manual override to the stage that was current when it arrived.
     * An override whose stage was already left is recorded for audit but moves nothing.
     * The case log entry is written before the override is recorded, so a crash in
     * between repeats the same idempotent call.
     */
    private void processOverride() {
        OverrideRequest request = state.pendingOverride();
        if (request == null || state.currentStageId() == null || state.pendingTransition() != null) {
            return;
        }
        WorkflowInstance current = state;
        String stageId = request.stageId() != null ? request.stageId() : current.currentStageId();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stageId", stageId);
        details.put("reason", request.reason());
        details.put("approvedBy", request.approvedBy());
        run("logCaseActivity", "override:" + current.manualOverrides().size() + ":manual_override",
            ctx -> activities.logCaseActivity(ctx, current.entityId(), "manual_override", details));

        WorkflowInstance applied = loopRecord(EventType.MANUAL_OVERRIDE_APPLIED,
            EventPayloads.manualOverrideApplied(stageId, request.reason(), request.approvedBy()));
        TransitionRequest next = applied.pendingTransition();
        if (next != null) {
            log.info("Stage {} completed by manual override approved by {}, moving to {}",
                stageId, request.approvedBy(), next.targetStageId());
        } else {
            log.info("Manual override approved by {} for stage {} recorded without a transition (now in {})",
                request.approvedBy(), stageId, applied.currentStageId());
        }
    }

    private void transition(TransitionRequest request) {
        Optional<Stage> target = state.findStage(request.targetStageId());
        if (target.isEmpty()) {
            log.warn("Ignoring transition to unknown stage '{}', staying in {}",
                request.targetStageId(), state.currentStageId());
            loopRecord(EventType.TRANSITION_REJECTED,
                EventPayloads.transitionRejected(request.targetStageId(), "unknown stage"));
            return;
        }
        if (state.currentStage().map(Stage::terminal).orElse(false)) {
            log.warn("Ignoring transition to '{}' from terminal stage {}",
                request.targetStageId(), state.currentStageId());
            loopRecord(EventType.TRANSITION_REJECTED,
                EventPayloads.transitionRejected(request.targetStageId(), "current stage is terminal"));
            return;
        }

        loopRecord(EventType.TRANSITION_STARTED, EventPayloads.transitionStarted(
            state.currentStageId(), target.get().stageId(), request.reason(), request.notes()));
        continueTransition();
    }

    /**
     * Run the remaining effects of the active transition and enter the target stage.
     */
    private void continueTransition() {
        WorkflowInstance current = state;
        ActiveTransition active = current.activeTransition();
        Stage to = current.findStage(active.toStageId())
            .orElseThrow(() -> new IllegalStateException("Unknown transition target: " + active.toStageId()));
        Stage from = current.findStage(active.fromStageId()).orElse(null);

        for (TransitionEffect effect : TransitionEffect.plan(from, to)) {
            if (active.isCompleted(effect)) {
                continue;
            }
            String key = "transition:" + active.startedSequence() + ":" + effect.name();
            performEffect(effect, key, current, from, to, active);
            loopRecord(EventType.TRANSITION_EFFECT_COMPLETED,
                EventPayloads.transitionEffectCompleted(to.stageId(), effect));
        }

        loopRecord(EventType.STAGE_ENTERED, EventPayloads.stageEntered(to, active.fromStageId()));
        log.info("Workflow {} entered stage {} ({}) from {}", current.workflowId(), to.stageId(),
            active.reason(), active.fromStageId());
    }

    private void performEffect(TransitionEffect effect, String key, WorkflowInstance current,
                               Stage from, Stage to, ActiveTransition active) {
        String entityId = current.entityId();
        switch (effect) {
            case EXIT_PERSIST -> {
                Duration inStage = timeInStage(current);
                run("exitStage", key, ctx -> activities.exitStage(ctx, entityId, from, inStage));
            }
            case EXIT_NOTIFY -> run("notifyStageTransition", key,
                ctx -> activities.notifyStageTransition(ctx, entityId, from, TransitionDirection.EXITED));
            case EXIT_LOG -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("stageId", from.stageId());
                details.put("stageName", from.name());
                details.put("durationHours", timeInStage(current).toHours());
                details.put("toStageId", to.stageId());
                run("logCaseActivity", key,
                    ctx -> activities.logCaseActivity(ctx, entityId, "stage_exited", details));
            }
            case ENTRY_PERSIST -> run("enterStage", key, ctx -> activities.enterStage(ctx, entityId, to));
            case ENTRY_NOTIFY -> run("notifyStageTransition", key,
                ctx -> activities.notifyStageTransition(ctx, entityId, to, TransitionDirection.ENTERED));
            case ENTRY_NOTIFY_TEAM -> run("notifyAssignedTeam", key,
                ctx -> activities.notifyAssignedTeam(ctx, entityId, to));
            case ENTRY_LOG -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("stageId", to.stageId());
                details.put("stageName", to.name());
                details.put("requirements", to.requirements());
                details.put("fromStageId", active.fromStageId());
                details.put("reason", active.reason().name());
                details.put("notes", active.notes());
                run("logCaseActivity", key,
                    ctx -> activities.logCaseActivity(ctx, entityId, "stage_entered", details));
            }
        }
    }

    private Duration timeInStage(WorkflowInstance current) {
        Instant enteredAt = current.currentStageEnteredAt();
        if (enteredAt == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(enteredAt, env.clock().instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private void checkReminders() {
        Instant now = env.clock().instant();
        String entityId = state.entityId();

        for (DeadlineReminder reminder : ReminderPolicy.dueDeadlineReminders(state.deadlines(), now)) {
            if (state.paused()) {
                return;
            }
            run("sendDeadlineReminder", "deadline:" + reminder.index() + ":" + reminder.notice(),
                ctx -> activities.sendDeadlineReminder(ctx, entityId, reminder.deadline(),
                    reminder.daysUntil(), reminder.notice()));
            EventType type = reminder.notice() == DeadlineNotice.UPCOMING
                ? EventType.DEADLINE_REMINDER_SENT
                : EventType.DEADLINE_OVERDUE_NOTIFIED;
            loopRecord(type, EventPayloads.deadlineReminder(reminder.index(), reminder.daysUntil(), reminder.notice()));
            log.info("Deadline '{}' {} notice sent ({} days)", reminder.deadline().description(),
                reminder.notice(), reminder.daysUntil());
        }

        for (CourtDateReminder reminder : ReminderPolicy.dueCourtDateReminders(state.courtDates(), now)) {
            if (state.paused()) {
                return;
            }
            run("createCourtDateReminder", "court:" + reminder.index() + ":" + reminder.window(),
                ctx -> activities.createCourtDateReminder(ctx, entityId, reminder.courtDate(),
                    reminder.window(), reminder.hoursUntil()));
            loopRecord(EventType.COURT_DATE_REMINDER_SENT,
                EventPayloads.courtDateReminder(reminder.index(), reminder.hoursUntil(), reminder.window()));
            log.info("Court date '{}' {} reminder sent ({} hours)", reminder.courtDate().description(),
                reminder.window(), reminder.hoursUntil());
        }
    }

    private void checkStageTimeout() {
        Optional<Instant> timeoutAt = state.stageTimeoutAt();
        if (timeoutAt.isEmpty() || env.clock().instant().isBefore(timeoutAt.get())) {
            return;
        }
        WorkflowInstance current = state;
        Stage stage = current.currentStage().orElseThrow();
        String issue = String.format("%s not completed within %d hours", stage.name(), stage.timeout().toHours());
        String key = "timeout:" + stage.stageId() + ":" + current.currentStageEnteredAt().toEpochMilli();

        run("escalateIssue", key, ctx -> activities.escalateIssue(ctx, current.entityId(), stage, issue));
        loopRecord(EventType.STAGE_TIMEOUT_ESCALATED,
            EventPayloads.stageTimeoutEscalated(stage.stageId(), stage.timeout(), issue));
        log.warn("Workflow {} escalated: {}", current.workflowId(), issue);
    }

    private void finish() {
        WorkflowInstance current = state;
        String entityId = current.entityId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("finalStageId", current.currentStageId());
        details.put("startedAt", String.valueOf(current.startedAt()));

        run("updateCaseStatus", "finish", ctx -> activities.updateCaseStatus(ctx, entityId, "completed"));
        run("logCaseActivity", "finish:workflow_completed",
            ctx -> activities.logCaseActivity(ctx, entityId, "workflow_completed", details));

        WorkflowInstance completed = loopRecord(EventType.WORKFLOW_COMPLETED, EventPayloads.empty());
        log.info("Workflow {} completed in stage {}", completed.workflowId(), completed.currentStageId());
        settleResult(completed, null);
    }

    private void fail(OrchestratorException failure) {
        WorkflowInstance current = state;
        if (current.isTerminal()) {
            return;
        }
        log.error("Workflow {} failed: {}", current.workflowId(), failure.getMessage(), failure);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", failure.getMessage());
        details.put("stack", stackTrace(failure));
        try {
            run("logCaseActivity", "failure:" + current.lastSequence(),
                ctx -> activities.logCaseActivity(ctx, current.entityId(), "workflow_failed", details));
        } catch (ActivityFailedException | ActivityInterruptedException logFailure) {
            log.warn("Could not record failure of workflow {} on the case: {}",
                current.workflowId(), logFailure.getMessage());
            failure.addSuppressed(logFailure);
        }

        try {
            WorkflowInstance failed = loopRecord(EventType.WORKFLOW_FAILED,
                EventPayloads.workflowFailed(failure.getErrorCode(), failure.getMessage()));
            settleResult(failed, failure);
        } catch (InstanceStoppedException e) {
            log.info("Workflow {} was stopped before its failure was recorded: {}",
                current.workflowId(), e.getMessage());
        }
    }

    private Instant nextWakeup() {
        Instant now = env.clock().instant();
        if (state.hasPendingWork()) {
            return now;
        }
        Instant poll = now.plus(env.pollInterval());
        return ReminderPolicy.nextThreshold(state.deadlines(), state.courtDates(),
                state.stageTimeoutAt().orElse(null), now)
            .filter(threshold -> threshold.isBefore(poll))
            .orElse(poll);
    }

    // ========== Snapshots ==========

    public void saveSnapshot() {
        env.instanceRepository().save(state);
    }

    /**
     * Save a snapshot and mark it in history so replay tools can see where it was taken.
     */
    public void checkpoint() {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                record(EventType.SNAPSHOT_CREATED, EventPayloads.snapshotCreated(state.lastSequence() + 1),
                    Event.ACTOR_RECOVERY, "checkpoint");
            }
            saveSnapshot();
        } finally {
            lock.unlock();
        }
    }

    // ========== Recording ==========

    private WorkflowInstance loopRecord(EventType type, JsonNode payload) {
        lock.lock();
        try {
            if (state.isTerminal()) {
                throw new InstanceStoppedException(state.status().name());
            }
            return record(type, payload, Event.ACTOR_LOOP, "loop");
        } finally {
            lock.unlock();
        }
    }

    private WorkflowInstance record(EventType type, JsonNode payload, String actorType, String actorId) {
        lock.lock();
        try {
            WorkflowInstance current = state;
            long sequence = current.lastSequence() + 1;
            Event event = Event.create(instanceId, sequence, type, env.clock().instant(), payload,
                instanceId + ":" + sequence, actorType, actorId);
            if (!env.eventRepository().append(event)) {
                throw new OptimisticLockException(current.workflowId(), sequence);
            }
            WorkflowInstance next = WorkflowStateReducer.apply(current, event);
            state = next;
            log.debug("Recorded {} (seq={}) for workflow {}", type, sequence, next.workflowId());
            env.listener().onEvent(next, event);
            return next;
        } finally {
            lock.unlock();
        }
    }

    private void settleResult(WorkflowInstance terminal, Throwable cause) {
        if (result.isDone()) {
            return;
        }
        switch (terminal.status()) {
            case COMPLETED -> result.complete(WorkflowResult.completed(terminal));
            case CANCELLED -> result.completeExceptionally(
                WorkflowExecutionException.cancelled(terminal.workflowId(), terminal.lastError()));
            case FAILED -> result.completeExceptionally(cause != null
                ? WorkflowExecutionException.failed(terminal.workflowId(), cause)
                : new WorkflowExecutionException(WorkflowExecutionException.ERROR_CODE,
                    terminal.workflowId(), terminal.lastError(), null));
            default -> throw new IllegalStateException("Not terminal: " + terminal.status());
        }
    }

    // ========== Activities ==========

    private <T> T call(String activityName, String key, ActivityExecutor.ActivityCall<T> call) {
        WorkflowInstance current = state;
        ActivityContext context = new ActivityContext(instanceId, current.workflowId(), current.entityType(),
            activityName, current.workflowId() + ":" + key + ":" + activityName, 1);
        return env.activityExecutor().execute(context, env.activityOptions(), call);
    }

    private void run(String activityName, String key, VoidActivity activity) {
        call(activityName, key, ctx -> {
            activity.run(ctx);
            return null;
        });
    }

    @FunctionalInterface
    private interface VoidActivity {
        void run(ActivityContext context) throws ActivityException;
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Raised inside an iteration when the instance was cancelled by a concurrent signal.
     */
    private static final class InstanceStoppedException extends RuntimeException {
        InstanceStoppedException(String status) {
            super("instance is " + status, null, false, false);
        }
    }
}
