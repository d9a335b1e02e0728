package com.controlplane.core.model;

import java.util.Map;

/**
 * Named set of provider credentials a cluster is operated with.
 */
public record CloudAccount(
    String name,
    CloudProvider provider,
    Map<String, String> credentials
) {
    public CloudAccount {
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }
}
