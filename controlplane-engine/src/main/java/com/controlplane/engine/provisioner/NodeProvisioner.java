package com.controlplane.engine.provisioner;

import com.controlplane.core.exception.StorageException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.model.Intent;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeProfile;
import com.controlplane.core.model.NodeSpec;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.step.CancellationToken;
import com.controlplane.core.step.LogSinkFactory;
import com.controlplane.engine.execution.TaskEngine;
import com.controlplane.engine.execution.TaskRun;
import com.controlplane.engine.logging.LoggingContext;
import com.controlplane.engine.service.ClusterService;
import com.controlplane.engine.service.CompletionReactor;
import com.controlplane.engine.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Fans a batch of node profiles out into one provisioning task per node.
 *
 * Returns once every task is started. The first failure to create or start a task aborts
 * the call; tasks started before it keep running.
 */
public class NodeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(NodeProvisioner.class);

    static final String ADD_NODE_REACTION = "add-node";

    private final WorkflowRegistry workflowRegistry;
    private final TaskEngine taskEngine;
    private final LogSinkFactory logSinkFactory;
    private final ClusterService clusterService;
    private final CompletionReactor reactor;

    public NodeProvisioner(
            WorkflowRegistry workflowRegistry,
            TaskEngine taskEngine,
            LogSinkFactory logSinkFactory,
            ClusterService clusterService,
            CompletionReactor reactor) {
        this.workflowRegistry = workflowRegistry;
        this.taskEngine = taskEngine;
        this.logSinkFactory = logSinkFactory;
        this.clusterService = clusterService;
        this.reactor = reactor;
    }

    /**
     * Start one provisioning task per profile.
     *
     * @param token Shared by every task of the batch; cancelling it aborts all of them
     * @param nodeProfiles One entry per node to create
     * @param kube Cluster the nodes join
     * @param config Cluster-wide config; must name the master the nodes join against
     * @throws ValidationException if the profiles or config are unusable; no task is created
     * @return Task ids, in profile order
     */
    public List<String> provisionNodes(CancellationToken token, List<NodeProfile> nodeProfiles,
                                       Kube kube, TaskConfig config) {
        if (nodeProfiles == null || nodeProfiles.isEmpty()) {
            throw new ValidationException("nodeProfiles", "must not be empty");
        }
        if (config == null) {
            throw new ValidationException("config", "must not be null");
        }
        config.validate();
        if (config.master() == null) {
            throw new ValidationException("config.master", "cluster has no master to join");
        }

        List<String> taskIds = new ArrayList<>(nodeProfiles.size());
        try (LoggingContext ctx = LoggingContext.forCluster(kube.name())) {
            String workflowKind = workflowRegistry.require(config.provider(), Intent.PROVISION_NODE);

            for (NodeProfile profile : nodeProfiles) {
                Task task = taskEngine.create(workflowKind);

                NodeSpec node = newNode(kube, profile, config);
                TaskConfig nodeConfig = config.withNodeProfile(profile).withNode(node);

                TaskRun run = taskEngine.run(task, nodeConfig, openSink(task.id()), token);
                reactor.onSuccess(run, ADD_NODE_REACTION,
                    outcome -> clusterService.update(kube.name(), k -> k.withNode(node)));

                log.info("Provisioning node {} ({}) in task {}", node.name(), profile.size(), task.id());
                taskIds.add(task.id());
            }
        }
        return taskIds;
    }

    private NodeSpec newNode(Kube kube, NodeProfile profile, TaskConfig config) {
        String role = profile.effectiveRole().name().toLowerCase(Locale.ROOT);
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String region = config.profile() != null ? config.profile().region() : null;
        return new NodeSpec(kube.name() + "-" + role + "-" + suffix, null,
            profile.effectiveRole(), region, null, null);
    }

    private OutputStream openSink(String taskId) {
        try {
            return logSinkFactory.open(taskId);
        } catch (IOException e) {
            throw new StorageException("Cannot open log sink for task " + taskId, e);
        }
    }
}
