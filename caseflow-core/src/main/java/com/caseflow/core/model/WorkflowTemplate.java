package com.caseflow.core.model;

import com.caseflow.core.exception.WorkflowValidationException;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned list of stages driving a lifecycle.
 * Running instances copy the stages at start, so registering a new version
 * never affects them.
 *
 * Invariants (see {@link #validate()}):
 * - at least one stage, stage ids unique and non-blank
 * - at least one terminal stage
 * - stage timeouts, where set, are positive
 */
public record WorkflowTemplate(
    String templateId,
    String name,
    EntityType entityType,
    String category,
    int version,
    List<Stage> stages,
    String description,
    Instant createdAt
) {
    public WorkflowTemplate {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * Stages sorted by order. Ties keep declaration order.
     */
    public List<Stage> orderedStages() {
        return stages.stream()
            .sorted(Comparator.comparingInt(Stage::order))
            .toList();
    }

    public Optional<Stage> findStage(String stageId) {
        return stages.stream()
            .filter(s -> s.stageId().equals(stageId))
            .findFirst();
    }

    /**
     * The stage flagged initial, or the lowest-ordered stage when none is flagged.
     */
    public Optional<Stage> initialStage() {
        List<Stage> ordered = orderedStages();
        return ordered.stream()
            .filter(Stage::initial)
            .findFirst()
            .or(() -> ordered.stream().findFirst());
    }

    /**
     * Validate structural invariants.
     *
     * @throws WorkflowValidationException if the template cannot drive an instance
     */
    public void validate() {
        if (templateId == null || templateId.isBlank()) {
            throw new WorkflowValidationException("templateId", "cannot be empty");
        }
        if (stages.isEmpty()) {
            throw new WorkflowValidationException("stages", "cannot be empty");
        }

        Set<String> seen = new HashSet<>();
        for (Stage stage : stages) {
            if (stage.stageId() == null || stage.stageId().isBlank()) {
                throw new WorkflowValidationException("stages", "stage id cannot be empty");
            }
            if (stage.name() == null || stage.name().isBlank()) {
                throw new WorkflowValidationException("stages", "stage " + stage.stageId() + " has no name");
            }
            if (!seen.add(stage.stageId())) {
                throw new WorkflowValidationException("stages", "duplicate stage id: " + stage.stageId());
            }
            if (stage.timeout() != null && (stage.timeout().isNegative() || stage.timeout().isZero())) {
                throw new WorkflowValidationException("stages", "stage " + stage.stageId() + " has a non-positive timeout");
            }
        }

        if (stages.stream().noneMatch(Stage::terminal)) {
            throw new WorkflowValidationException("stages", "no terminal stage in template " + templateId);
        }
    }

    public WorkflowTemplate withVersion(int newVersion, Instant registeredAt) {
        return new WorkflowTemplate(
            templateId, name, entityType, category, newVersion,
            stages, description, registeredAt
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String templateId;
        private String name;
        private EntityType entityType = EntityType.CASE;
        private String category;
        private int version = 1;
        private List<Stage> stages = List.of();
        private String description;
        private Instant createdAt = Instant.now();

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder stages(List<Stage> stages) {
            this.stages = stages;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkflowTemplate build() {
            return new WorkflowTemplate(
                templateId, name, entityType, category, version,
                stages, description, createdAt
            );
        }
    }
}
