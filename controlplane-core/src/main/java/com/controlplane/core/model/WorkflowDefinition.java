package com.controlplane.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Named, ordered list of steps.
 *
 * Invariants:
 * - kind is not blank
 * - steps is non-empty and holds no duplicate names
 */
public record WorkflowDefinition(
    String kind,
    List<String> steps,
    String description
) {
    public WorkflowDefinition {
        steps = List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final String kind;
        private final List<String> steps = new ArrayList<>();
        private String description;

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder step(String stepName) {
            this.steps.add(stepName);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(kind, steps, description);
        }
    }
}
