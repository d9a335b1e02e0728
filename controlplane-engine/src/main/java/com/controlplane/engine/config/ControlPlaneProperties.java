package com.controlplane.engine.config;

import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Settings under the {@code controlplane} prefix.
 *
 * <pre>
 * controlplane:
 *   engine:
 *     worker-threads: 8
 *     shutdown-grace: 30s
 *   logs:
 *     directory: data/task-logs
 *   store:
 *     type: memory   # memory or jdbc
 *   reactions:
 *     max-attempts: 5
 *     initial-backoff: 500ms
 *     max-backoff: 30s
 *   provisioning:
 *     deadline: 10m
 *   cluster:
 *     max-update-attempts: 10
 *   accounts:
 *     - name: do-main
 *       provider: DIGITALOCEAN
 *       credentials:
 *         token: ...
 * </pre>
 */
@ConfigurationProperties(prefix = "controlplane")
public record ControlPlaneProperties(
    @DefaultValue Engine engine,
    @DefaultValue Logs logs,
    @DefaultValue Store store,
    @DefaultValue Reactions reactions,
    @DefaultValue Provisioning provisioning,
    @DefaultValue Cluster cluster,
    List<Account> accounts
) {
    public ControlPlaneProperties {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public record Engine(@DefaultValue("8") int workerThreads,
                         @DefaultValue("30s") Duration shutdownGrace) {
    }

    public record Logs(@DefaultValue("data/task-logs") Path directory) {
    }

    public record Store(@DefaultValue("memory") String type) {
    }

    public record Reactions(
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("500ms") Duration initialBackoff,
        @DefaultValue("30s") Duration maxBackoff
    ) {
        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .build();
        }
    }

    public record Provisioning(@DefaultValue("10m") Duration deadline) {
    }

    public record Cluster(@DefaultValue("10") int maxUpdateAttempts) {
    }

    public record Account(String name, CloudProvider provider, Map<String, String> credentials) {
    }
}
