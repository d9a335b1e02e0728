package com.controlplane.engine.workflow;

import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.Intent;
import com.controlplane.core.model.WorkflowDefinition;
import com.controlplane.core.model.WorkflowSet;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table resolving (provider, intent) to a workflow kind, and a kind to its ordered steps.
 * Built once at start-up; immutable afterwards.
 */
public final class WorkflowRegistry {

    private final Map<CloudProvider, WorkflowSet> workflowSets;
    private final Map<String, WorkflowDefinition> definitions;

    private WorkflowRegistry(Map<CloudProvider, WorkflowSet> workflowSets,
                             Map<String, WorkflowDefinition> definitions) {
        this.workflowSets = Map.copyOf(workflowSets);
        this.definitions = Map.copyOf(definitions);
    }

    /**
     * Resolve the workflow kind serving an intent on a provider.
     *
     * @return The kind, or empty if the provider does not support the intent
     */
    public Optional<String> resolve(CloudProvider provider, Intent intent) {
        if (provider == null || intent == null) {
            return Optional.empty();
        }
        WorkflowSet set = workflowSets.get(provider);
        return set == null ? Optional.empty() : set.kindFor(intent);
    }

    /**
     * Same as {@link #resolve} but reports an unsupported intent as {@link NotFoundException}.
     */
    public String require(CloudProvider provider, Intent intent) {
        return resolve(provider, intent)
            .orElseThrow(() -> new NotFoundException("Workflow", provider + "/" + intent));
    }

    public Optional<WorkflowDefinition> definition(String workflowKind) {
        return workflowKind == null ? Optional.empty() : Optional.ofNullable(definitions.get(workflowKind));
    }

    public Optional<WorkflowSet> workflowSet(CloudProvider provider) {
        return provider == null ? Optional.empty() : Optional.ofNullable(workflowSets.get(provider));
    }

    public Set<String> kinds() {
        return definitions.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, WorkflowDefinition> definitions = new LinkedHashMap<>();
        private final Map<CloudProvider, Map<Intent, String>> mappings = new EnumMap<>(CloudProvider.class);

        public Builder define(WorkflowDefinition definition) {
            validate(definition);
            if (definitions.putIfAbsent(definition.kind(), definition) != null) {
                throw new ValidationException("workflow kind", definition.kind() + " defined twice");
            }
            return this;
        }

        public Builder map(CloudProvider provider, Intent intent, String workflowKind) {
            mappings.computeIfAbsent(provider, p -> new EnumMap<>(Intent.class)).put(intent, workflowKind);
            return this;
        }

        public WorkflowRegistry build() {
            Map<CloudProvider, WorkflowSet> sets = new EnumMap<>(CloudProvider.class);
            mappings.forEach((provider, kinds) -> {
                kinds.forEach((intent, kind) -> {
                    if (!definitions.containsKey(kind)) {
                        throw new ValidationException("workflow mapping",
                            provider + "/" + intent + " points at undefined kind " + kind);
                    }
                });
                sets.put(provider, new WorkflowSet(provider, kinds));
            });
            return new WorkflowRegistry(sets, definitions);
        }

        private static void validate(WorkflowDefinition definition) {
            if (definition.kind() == null || definition.kind().isBlank()) {
                throw new ValidationException("workflow kind", "must not be blank");
            }
            if (definition.steps().isEmpty()) {
                throw new ValidationException("workflow " + definition.kind(), "has no steps");
            }
            Set<String> seen = new HashSet<>();
            for (String step : definition.steps()) {
                if (!seen.add(step)) {
                    throw new ValidationException("workflow " + definition.kind(), "step " + step + " listed twice");
                }
            }
        }
    }
}
