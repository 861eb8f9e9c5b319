package com.caseflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable state of one lifecycle run, case or employee.
 * Always the fold of the instance's event history; only the reducer builds new values.
 *
 * Primary Key: instanceId
 * Unique Constraint: workflowId
 *
 * Invariants:
 * - currentStageId, once set, is a member of stages
 * - pausedAt != null iff paused
 * - completedAt is set exactly once, when a terminal stage is entered
 * - deadlines, courtDates, completedRequirements, escalations and manualOverrides only grow
 * - stageTimeoutEscalated is reset whenever a stage is entered
 * - lastSequence is the sequence number of the last applied event
 */
public record WorkflowInstance(
    // Primary key
    UUID instanceId,

    // Identity
    String workflowId,
    String entityId,
    EntityType entityType,
    String templateId,
    JsonNode input,

    // Status
    WorkflowStatus status,

    // Stages, copied from the template at load time
    List<Stage> stages,
    String currentStageId,
    Instant currentStageEnteredAt,
    boolean stageTimeoutEscalated,

    // Accumulated facts
    List<CompletedRequirement> completedRequirements,
    List<Deadline> deadlines,
    List<CourtDate> courtDates,
    List<Escalation> escalations,
    List<ManualOverride> manualOverrides,

    // Pause
    boolean paused,
    Instant pausedAt,

    // Timing
    Instant startedAt,
    Instant completedAt,

    // Signals received but not yet drained by the loop
    List<PendingRequirement> pendingRequirements,
    List<Deadline> pendingDeadlines,
    List<CourtDate> pendingCourtDates,
    TransitionRequest pendingTransition,
    OverrideRequest pendingOverride,

    // Loop progress
    String requirementCheckStageId,
    ActiveTransition activeTransition,

    // Error tracking
    String lastError,

    // Versioning
    long lastSequence
) {
    public WorkflowInstance {
        stages = copy(stages);
        completedRequirements = copy(completedRequirements);
        deadlines = copy(deadlines);
        courtDates = copy(courtDates);
        escalations = copy(escalations);
        manualOverrides = copy(manualOverrides);
        pendingRequirements = copy(pendingRequirements);
        pendingDeadlines = copy(pendingDeadlines);
        pendingCourtDates = copy(pendingCourtDates);
    }

    /**
     * State before any event has been applied.
     */
    public static WorkflowInstance empty(UUID instanceId) {
        return builder().instanceId(instanceId).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isTemplateLoaded() {
        return !stages.isEmpty();
    }

    public Optional<Stage> findStage(String stageId) {
        if (stageId == null) {
            return Optional.empty();
        }
        return stages.stream()
            .filter(s -> s.stageId().equals(stageId))
            .findFirst();
    }

    public Optional<Stage> currentStage() {
        return findStage(currentStageId);
    }

    /**
     * The stage whose order follows the current one, if any.
     */
    public Optional<Stage> nextStage() {
        Optional<Stage> current = currentStage();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        List<Stage> ordered = new ArrayList<>(stages);
        ordered.sort((a, b) -> Integer.compare(a.order(), b.order()));
        int index = ordered.indexOf(current.get());
        return index >= 0 && index + 1 < ordered.size()
            ? Optional.of(ordered.get(index + 1))
            : Optional.empty();
    }

    /**
     * Requirement ids completed while the given stage was current.
     */
    public List<String> completedRequirementIds(String stageId) {
        return completedRequirements.stream()
            .filter(r -> r.stageId().equals(stageId))
            .map(CompletedRequirement::requirementId)
            .distinct()
            .toList();
    }

    /**
     * When the current stage's timeout lapses, if it has one and has not escalated yet.
     */
    public Optional<Instant> stageTimeoutAt() {
        if (stageTimeoutEscalated || currentStageEnteredAt == null) {
            return Optional.empty();
        }
        return currentStage()
            .filter(stage -> stage.timeout() != null && !stage.terminal())
            .map(stage -> currentStageEnteredAt.plus(stage.timeout()));
    }

    /**
     * Whether the loop has anything to do besides reminder checks.
     */
    @JsonIgnore
    public boolean hasPendingWork() {
        return !pendingRequirements.isEmpty()
            || !pendingDeadlines.isEmpty()
            || !pendingCourtDates.isEmpty()
            || pendingTransition != null
            || pendingOverride != null
            || requirementCheckStageId != null
            || activeTransition != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public static class Builder {
        private UUID instanceId;
        private String workflowId;
        private String entityId;
        private EntityType entityType;
        private String templateId;
        private JsonNode input;
        private WorkflowStatus status;
        private List<Stage> stages = List.of();
        private String currentStageId;
        private Instant currentStageEnteredAt;
        private boolean stageTimeoutEscalated;
        private List<CompletedRequirement> completedRequirements = List.of();
        private List<Deadline> deadlines = List.of();
        private List<CourtDate> courtDates = List.of();
        private List<Escalation> escalations = List.of();
        private List<ManualOverride> manualOverrides = List.of();
        private boolean paused;
        private Instant pausedAt;
        private Instant startedAt;
        private Instant completedAt;
        private List<PendingRequirement> pendingRequirements = List.of();
        private List<Deadline> pendingDeadlines = List.of();
        private List<CourtDate> pendingCourtDates = List.of();
        private TransitionRequest pendingTransition;
        private OverrideRequest pendingOverride;
        private String requirementCheckStageId;
        private ActiveTransition activeTransition;
        private String lastError;
        private long lastSequence;

        Builder() {
        }

        Builder(WorkflowInstance source) {
            this.instanceId = source.instanceId;
            this.workflowId = source.workflowId;
            this.entityId = source.entityId;
            this.entityType = source.entityType;
            this.templateId = source.templateId;
            this.input = source.input;
            this.status = source.status;
            this.stages = source.stages;
            this.currentStageId = source.currentStageId;
            this.currentStageEnteredAt = source.currentStageEnteredAt;
            this.stageTimeoutEscalated = source.stageTimeoutEscalated;
            this.completedRequirements = source.completedRequirements;
            this.deadlines = source.deadlines;
            this.courtDates = source.courtDates;
            this.escalations = source.escalations;
            this.manualOverrides = source.manualOverrides;
            this.paused = source.paused;
            this.pausedAt = source.pausedAt;
            this.startedAt = source.startedAt;
            this.completedAt = source.completedAt;
            this.pendingRequirements = source.pendingRequirements;
            this.pendingDeadlines = source.pendingDeadlines;
            this.pendingCourtDates = source.pendingCourtDates;
            this.pendingTransition = source.pendingTransition;
            this.pendingOverride = source.pendingOverride;
            this.requirementCheckStageId = source.requirementCheckStageId;
            this.activeTransition = source.activeTransition;
            this.lastError = source.lastError;
            this.lastSequence = source.lastSequence;
        }

        public Builder instanceId(UUID instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder stages(List<Stage> stages) {
            this.stages = stages;
            return this;
        }

        public Builder currentStageId(String currentStageId) {
            this.currentStageId = currentStageId;
            return this;
        }

        public Builder currentStageEnteredAt(Instant currentStageEnteredAt) {
            this.currentStageEnteredAt = currentStageEnteredAt;
            return this;
        }

        public Builder stageTimeoutEscalated(boolean stageTimeoutEscalated) {
            this.stageTimeoutEscalated = stageTimeoutEscalated;
            return this;
        }

        public Builder completedRequirements(List<CompletedRequirement> completedRequirements) {
            this.completedRequirements = completedRequirements;
            return this;
        }

        public Builder deadlines(List<Deadline> deadlines) {
            this.deadlines = deadlines;
            return this;
        }

        public Builder courtDates(List<CourtDate> courtDates) {
            this.courtDates = courtDates;
            return this;
        }

        public Builder escalations(List<Escalation> escalations) {
            this.escalations = escalations;
            return this;
        }

        public Builder manualOverrides(List<ManualOverride> manualOverrides) {
            this.manualOverrides = manualOverrides;
            return this;
        }

        public Builder paused(boolean paused) {
            this.paused = paused;
            return this;
        }

        public Builder pausedAt(Instant pausedAt) {
            this.pausedAt = pausedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder pendingRequirements(List<PendingRequirement> pendingRequirements) {
            this.pendingRequirements = pendingRequirements;
            return this;
        }

        public Builder pendingDeadlines(List<Deadline> pendingDeadlines) {
            this.pendingDeadlines = pendingDeadlines;
            return this;
        }

        public Builder pendingCourtDates(List<CourtDate> pendingCourtDates) {
            this.pendingCourtDates = pendingCourtDates;
            return this;
        }

        public Builder pendingTransition(TransitionRequest pendingTransition) {
            this.pendingTransition = pendingTransition;
            return this;
        }

        public Builder pendingOverride(OverrideRequest pendingOverride) {
            this.pendingOverride = pendingOverride;
            return this;
        }

        public Builder requirementCheckStageId(String requirementCheckStageId) {
            this.requirementCheckStageId = requirementCheckStageId;
            return this;
        }

        public Builder activeTransition(ActiveTransition activeTransition) {
            this.activeTransition = activeTransition;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder lastSequence(long lastSequence) {
            this.lastSequence = lastSequence;
            return this;
        }

        public WorkflowInstance build() {
            return new WorkflowInstance(
                instanceId, workflowId, entityId, entityType, templateId, input,
                status, stages, currentStageId, currentStageEnteredAt, stageTimeoutEscalated,
                completedRequirements, deadlines, courtDates, escalations, manualOverrides,
                paused, pausedAt, startedAt, completedAt,
                pendingRequirements, pendingDeadlines, pendingCourtDates, pendingTransition, pendingOverride,
                requirementCheckStageId, activeTransition,
                lastError, lastSequence
            );
        }
    }
}
