package com.caseflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.List;

/**
 * One node of an ordered lifecycle template.
 *
 * Invariants:
 * - stageId is unique within a template
 * - requirements are requirement ids, scoped to this stage when completed
 * - timeout, when set, is positive; it is measured from stage entry and escalates once per visit
 */
public record Stage(
    String stageId,
    String name,
    int order,
    List<String> requirements,

    // Flags
    boolean initial,
    boolean terminal,
    boolean autoTransition,
    boolean notifyOnEntry,
    boolean notifyOnExit,

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Duration timeout
) {
    public Stage {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    public boolean hasRequirements() {
        return !requirements.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String stageId;
        private String name;
        private int order;
        private List<String> requirements = List.of();
        private boolean initial;
        private boolean terminal;
        private boolean autoTransition;
        private boolean notifyOnEntry;
        private boolean notifyOnExit;
        private Duration timeout;

        public Builder stageId(String stageId) {
            this.stageId = stageId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder requirements(List<String> requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder initial(boolean initial) {
            this.initial = initial;
            return this;
        }

        public Builder terminal(boolean terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder autoTransition(boolean autoTransition) {
            this.autoTransition = autoTransition;
            return this;
        }

        public Builder notifyOnEntry(boolean notifyOnEntry) {
            this.notifyOnEntry = notifyOnEntry;
            return this;
        }

        public Builder notifyOnExit(boolean notifyOnExit) {
            this.notifyOnExit = notifyOnExit;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Stage build() {
            return new Stage(
                stageId, name, order, requirements,
                initial, terminal, autoTransition, notifyOnEntry, notifyOnExit, timeout
            );
        }
    }
}
