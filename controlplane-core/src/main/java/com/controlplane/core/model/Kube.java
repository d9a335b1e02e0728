package com.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recorded state of one Kubernetes cluster.
 * Treated as immutable: every change produces a new record that replaces the stored one
 * through a compare-and-swap on its store revision.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Kube(
    String name,
    String accountName,
    CloudProvider provider,
    ClusterProfile profile,
    Map<String, NodeSpec> masters,
    Map<String, NodeSpec> nodes
) {
    public Kube {
        masters = masters == null ? Map.of() : Map.copyOf(masters);
        nodes = nodes == null ? Map.of() : Map.copyOf(nodes);
    }

    public boolean hasMaster(String nodeName) {
        return masters.containsKey(nodeName);
    }

    public boolean hasNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    /**
     * Master new nodes join against. The lowest name wins so repeated calls agree.
     */
    public Optional<NodeSpec> anyMaster() {
        return masters.values().stream()
            .min(Comparator.comparing(NodeSpec::name));
    }

    public Kube withNode(NodeSpec node) {
        Map<String, NodeSpec> updated = new LinkedHashMap<>(nodes);
        updated.put(node.name(), node);
        return new Kube(name, accountName, provider, profile, masters, updated);
    }

    public Kube withoutNode(String nodeName) {
        Map<String, NodeSpec> updated = new LinkedHashMap<>(nodes);
        updated.remove(nodeName);
        return new Kube(name, accountName, provider, profile, masters, updated);
    }
}
