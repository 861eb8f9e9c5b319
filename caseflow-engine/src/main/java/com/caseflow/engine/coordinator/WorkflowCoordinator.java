package com.caseflow.engine.coordinator;

import com.caseflow.core.exception.DuplicateInstanceException;
import com.caseflow.core.exception.InvalidStateTransitionException;
import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.exception.OrchestratorException;
import com.caseflow.core.exception.WorkflowExecutionException;
import com.caseflow.core.exception.WorkflowValidationException;
import com.caseflow.core.model.WorkflowInstance;
import com.caseflow.core.model.WorkflowStatus;
import com.caseflow.core.query.CurrentStageView;
import com.caseflow.core.query.RequirementsView;
import com.caseflow.core.query.WorkflowQueries;
import com.caseflow.core.query.WorkflowResult;
import com.caseflow.core.repository.WorkflowInstanceRepository;
import com.caseflow.core.signal.WorkflowSignal;
import com.caseflow.engine.logging.LoggingContext;
import com.caseflow.engine.runtime.RunnerEnvironment;
import com.caseflow.engine.runtime.WorkflowDispatcher;
import com.caseflow.engine.runtime.WorkflowRehydrator;
import com.caseflow.engine.runtime.WorkflowRunner;
import com.caseflow.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Control plane for lifecycle workflows.
 * Creates runners, routes signals to them and answers queries from their latest state.
 *
 * Live instances are served from their runner; finished ones from the snapshot store
 * plus any events recorded after the snapshot.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final RunnerEnvironment env;
    private final WorkflowDispatcher dispatcher;
    private final WorkflowRehydrator rehydrator;
    private final WorkflowInstanceRepository instanceRepository;

    public WorkflowCoordinator(RunnerEnvironment env, WorkflowDispatcher dispatcher, WorkflowRehydrator rehydrator) {
        this.env = env;
        this.dispatcher = dispatcher;
        this.rehydrator = rehydrator;
        this.instanceRepository = env.instanceRepository();
    }

    @Override
    public synchronized WorkflowInstance startWorkflow(StartWorkflowRequest request) {
        validate(request);
        String workflowId = request.workflowId() != null && !request.workflowId().isBlank()
            ? request.workflowId()
            : generateWorkflowId(request);

        Optional<WorkflowInstance> existing = instanceRepository.findByWorkflowId(workflowId);
        if (existing.isPresent()) {
            log.info("Found existing instance for workflowId={}: {}", workflowId, existing.get().instanceId());
            return currentState(existing.get());
        }

        Optional<WorkflowInstance> active = instanceRepository.findByEntityId(request.entityId()).stream()
            .filter(instance -> instance.entityType() == request.entityType())
            .filter(instance -> !instance.isTerminal())
            .findFirst();
        if (active.isPresent()) {
            throw new DuplicateInstanceException(request.entityId(), active.get().workflowId());
        }

        try (LoggingContext ignored = LoggingContext.forWorkflow(workflowId, request.entityId())) {
            WorkflowRunner runner = WorkflowRunner.start(UUID.randomUUID(), workflowId, request.entityId(),
                request.entityType(), request.templateId(), request.input(), env);
            dispatcher.register(runner);
            dispatcher.wake(runner.instanceId());
            return runner.state();
        }
    }

    /**
     * Drive an instance rebuilt from history. Used on startup to continue active instances.
     *
     * @return false if a runner for the instance is already registered
     */
    public boolean adopt(WorkflowInstance state) {
        if (dispatcher.runner(state.instanceId()).isPresent()) {
            return false;
        }
        WorkflowRunner runner = WorkflowRunner.resume(state, env);
        dispatcher.register(runner);
        dispatcher.wake(runner.instanceId());
        log.info("Adopted workflow {} at seq {} in stage {}", state.workflowId(), state.lastSequence(),
            state.currentStageId());
        return true;
    }

    // ========== Signals ==========

    @Override
    public void completeRequirement(String workflowId, String requirementId, String notes) {
        deliver(workflowId, WorkflowSignal.completeRequirement(requirementId, notes));
    }

    @Override
    public void transitionStage(String workflowId, String targetStageId, String notes) {
        deliver(workflowId, WorkflowSignal.transitionStage(targetStageId, notes));
    }

    @Override
    public void addDeadline(String workflowId, Instant date, String description) {
        deliver(workflowId, WorkflowSignal.addDeadline(date, description));
    }

    @Override
    public void addCourtDate(String workflowId, Instant date, String description) {
        deliver(workflowId, WorkflowSignal.addCourtDate(date, description));
    }

    @Override
    public void manualOverride(String workflowId, String reason, String approvedBy) {
        deliver(workflowId, WorkflowSignal.manualOverride(reason, approvedBy));
    }

    @Override
    public void escalate(String workflowId, String reason, String escalatedTo) {
        deliver(workflowId, WorkflowSignal.escalate(reason, escalatedTo));
    }

    @Override
    public void pauseWorkflow(String workflowId) {
        deliver(workflowId, WorkflowSignal.pause());
    }

    @Override
    public void resumeWorkflow(String workflowId) {
        deliver(workflowId, WorkflowSignal.resume());
    }

    @Override
    public void cancelWorkflow(String workflowId, String reason) {
        deliver(workflowId, WorkflowSignal.cancel(reason));
    }

    private void deliver(String workflowId, WorkflowSignal signal) {
        try (LoggingContext ignored = LoggingContext.forSignal(workflowId, signal.type().name())) {
            WorkflowRunner runner = liveRunner(workflowId);
            runner.signal(signal);
            log.info("Delivered {} to workflow {}", signal.type(), workflowId);
            dispatcher.wake(runner.instanceId());
        }
    }

    private WorkflowRunner liveRunner(String workflowId) {
        WorkflowInstance stored = instanceRepository.findByWorkflowId(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        return dispatcher.runner(stored.instanceId()).orElseThrow(() -> {
            WorkflowInstance current = currentState(stored);
            return new InvalidStateTransitionException(workflowId, current.status(), "signal");
        });
    }

    // ========== Queries ==========

    @Override
    public WorkflowInstance getWorkflowState(String workflowId) {
        WorkflowInstance stored = instanceRepository.findByWorkflowId(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        return WorkflowQueries.workflowState(currentState(stored));
    }

    @Override
    public CurrentStageView getCurrentStage(String workflowId) {
        return WorkflowQueries.currentStage(getWorkflowState(workflowId));
    }

    @Override
    public RequirementsView getRequirements(String workflowId) {
        return WorkflowQueries.requirements(getWorkflowState(workflowId));
    }

    @Override
    public WorkflowInstance getWorkflow(UUID instanceId) {
        return dispatcher.runner(instanceId)
            .map(WorkflowRunner::state)
            .or(() -> rehydrator.load(instanceId))
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", instanceId.toString()));
    }

    @Override
    public List<WorkflowInstance> listWorkflows(WorkflowQuery query) {
        List<WorkflowInstance> stored;
        if (query.entityId() != null) {
            stored = instanceRepository.findByEntityId(query.entityId());
        } else if (query.status() != null) {
            stored = instanceRepository.findByStatus(query.status(), query.limit());
        } else {
            stored = instanceRepository.findAll(query.limit());
        }

        // Snapshots can lag behind live runners.
        Map<UUID, WorkflowInstance> merged = new LinkedHashMap<>();
        for (WorkflowInstance instance : stored) {
            merged.put(instance.instanceId(), instance);
        }
        for (WorkflowRunner runner : dispatcher.runners()) {
            merged.computeIfPresent(runner.instanceId(), (id, snapshot) -> runner.state());
        }

        return merged.values().stream()
            .filter(instance -> query.status() == null || instance.status() == query.status())
            .sorted(Comparator.comparing(WorkflowInstance::startedAt,
                Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    @Override
    public WorkflowStatistics statistics() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus status : WorkflowStatus.values()) {
            counts.put(status, 0L);
        }
        counts.putAll(instanceRepository.countByStatus());
        return new WorkflowStatistics(counts, dispatcher.activeCount());
    }

    @Override
    public WorkflowResult awaitResult(String workflowId, Duration timeout) throws TimeoutException {
        WorkflowInstance stored = instanceRepository.findByWorkflowId(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        Optional<WorkflowRunner> runner = dispatcher.runner(stored.instanceId());
        if (runner.isEmpty()) {
            return finishedResult(currentState(stored));
        }
        try {
            return runner.get().result().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof OrchestratorException orchestratorException) {
                throw orchestratorException;
            }
            throw WorkflowExecutionException.failed(workflowId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw WorkflowExecutionException.failed(workflowId, e);
        }
    }

    // ========== Internal Methods ==========

    private WorkflowInstance currentState(WorkflowInstance stored) {
        return dispatcher.runner(stored.instanceId())
            .map(WorkflowRunner::state)
            .or(() -> rehydrator.load(stored.instanceId()))
            .orElse(stored);
    }

    private static WorkflowResult finishedResult(WorkflowInstance state) {
        return switch (state.status()) {
            case COMPLETED -> WorkflowResult.completed(state);
            case CANCELLED -> throw WorkflowExecutionException.cancelled(state.workflowId(), state.lastError());
            case FAILED -> throw new WorkflowExecutionException(WorkflowExecutionException.ERROR_CODE,
                state.workflowId(), state.lastError(), null);
            default -> throw new InvalidStateTransitionException(state.workflowId(), state.status(), "await");
        };
    }

    private static void validate(StartWorkflowRequest request) {
        if (request.entityId() == null || request.entityId().isBlank()) {
            throw new WorkflowValidationException("entityId", "cannot be empty");
        }
        if (request.entityType() == null) {
            throw new WorkflowValidationException("entityType", "cannot be null");
        }
        if (request.templateId() == null || request.templateId().isBlank()) {
            throw new WorkflowValidationException("templateId", "cannot be empty");
        }
    }

    private static String generateWorkflowId(StartWorkflowRequest request) {
        return request.entityType().name().toLowerCase(Locale.ROOT) + "-" + request.entityId()
            + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
