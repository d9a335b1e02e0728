package com.controlplane.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Per-provider mapping from intent to workflow kind.
 */
public record WorkflowSet(CloudProvider provider, Map<Intent, String> kinds) {

    public WorkflowSet {
        kinds = Map.copyOf(kinds);
    }

    public Optional<String> kindFor(Intent intent) {
        return Optional.ofNullable(kinds.get(intent));
    }
}
