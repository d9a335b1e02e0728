package com.controlplane.engine.service;

import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.OperationNotAllowedException;
import com.controlplane.core.exception.StorageException;
import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.model.Intent;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeProfile;
import com.controlplane.core.model.NodeSpec;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.repository.CloudAccountRepository;
import com.controlplane.core.repository.TaskRepository;
import com.controlplane.core.step.CancellationToken;
import com.controlplane.core.step.LogSinkFactory;
import com.controlplane.engine.execution.TaskEngine;
import com.controlplane.engine.execution.TaskRun;
import com.controlplane.engine.logging.LoggingContext;
import com.controlplane.engine.provisioner.NodeProvisioner;
import com.controlplane.engine.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;

/**
 * Cluster-level operations that run as tasks: tearing down a cluster, removing a node,
 * adding nodes. Each call resolves the provider's workflow, starts it, and registers the
 * record change that must follow a successful run.
 */
public class ClusterLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ClusterLifecycleService.class);

    static final String DELETE_CLUSTER_REACTION = "delete-cluster";
    static final String REMOVE_NODE_REACTION = "remove-node";

    private final ClusterService clusterService;
    private final CloudAccountRepository accountRepository;
    private final WorkflowRegistry workflowRegistry;
    private final TaskEngine taskEngine;
    private final TaskRepository taskRepository;
    private final LogSinkFactory logSinkFactory;
    private final CompletionReactor reactor;
    private final NodeProvisioner nodeProvisioner;
    private final Duration provisioningDeadline;

    public ClusterLifecycleService(
            ClusterService clusterService,
            CloudAccountRepository accountRepository,
            WorkflowRegistry workflowRegistry,
            TaskEngine taskEngine,
            TaskRepository taskRepository,
            LogSinkFactory logSinkFactory,
            CompletionReactor reactor,
            NodeProvisioner nodeProvisioner,
            Duration provisioningDeadline) {
        this.clusterService = clusterService;
        this.accountRepository = accountRepository;
        this.workflowRegistry = workflowRegistry;
        this.taskEngine = taskEngine;
        this.taskRepository = taskRepository;
        this.logSinkFactory = logSinkFactory;
        this.reactor = reactor;
        this.nodeProvisioner = nodeProvisioner;
        this.provisioningDeadline = provisioningDeadline;
    }

    /**
     * Tear down every machine of a cluster. Once the task succeeds the cluster record
     * and all of its tasks are removed.
     *
     * @return The started task
     */
    public TaskRun deleteCluster(String clusterName) {
        try (LoggingContext ctx = LoggingContext.forCluster(clusterName)) {
            Kube kube = clusterService.get(clusterName);
            TaskConfig config = TaskConfig.forCluster(kube, account(kube));

            String workflowKind = workflowRegistry.require(config.provider(), Intent.DELETE_CLUSTER);
            TaskRun run = start(workflowKind, config, CancellationToken.create());

            reactor.onSuccess(run, DELETE_CLUSTER_REACTION, outcome -> {
                if (!clusterService.delete(clusterName)) {
                    log.info("Cluster record {} already removed", clusterName);
                }
                int removed = taskRepository.deleteByCluster(clusterName);
                log.info("Removed {} task(s) of deleted cluster {}", removed, clusterName);
            });

            log.info("Deleting cluster {} in task {}", clusterName, run.taskId());
            return run;
        }
    }

    /**
     * Remove a worker node. Master nodes cannot be removed on their own.
     *
     * @return The started task
     * @throws OperationNotAllowedException if the node is a master
     * @throws NotFoundException if the cluster or node does not exist
     */
    public TaskRun deleteNode(String clusterName, String nodeName) {
        try (LoggingContext ctx = LoggingContext.forCluster(clusterName)) {
            Kube kube = clusterService.get(clusterName);
            if (kube.hasMaster(nodeName)) {
                throw new OperationNotAllowedException(
                    "Node " + nodeName + " is a master of cluster " + clusterName + " and cannot be deleted");
            }
            NodeSpec node = kube.nodes().get(nodeName);
            if (node == null) {
                throw new NotFoundException("Node", clusterName + "/" + nodeName);
            }

            TaskConfig config = TaskConfig.forCluster(kube, account(kube)).withNode(node);
            String workflowKind = workflowRegistry.require(config.provider(), Intent.DELETE_NODE);
            TaskRun run = start(workflowKind, config, CancellationToken.create());

            reactor.onSuccess(run, REMOVE_NODE_REACTION,
                outcome -> clusterService.update(clusterName, k -> k.withoutNode(nodeName)));

            log.info("Deleting node {} in task {}", nodeName, run.taskId());
            return run;
        }
    }

    /**
     * Provision new nodes against one of the cluster's masters.
     * All tasks of the batch share a deadline.
     *
     * @return Task ids, one per profile
     */
    public List<String> addNodes(String clusterName, List<NodeProfile> nodeProfiles) {
        try (LoggingContext ctx = LoggingContext.forCluster(clusterName)) {
            Kube kube = clusterService.get(clusterName);
            NodeSpec master = kube.anyMaster()
                .orElseThrow(() -> new NotFoundException("Master", clusterName));

            TaskConfig config = TaskConfig.forCluster(kube, account(kube)).withMaster(master);
            CancellationToken deadline = CancellationToken.withTimeout(provisioningDeadline);
            return nodeProvisioner.provisionNodes(deadline, nodeProfiles, kube, config);
        }
    }

    /**
     * Tasks of a cluster, oldest first.
     *
     * @throws NotFoundException if the cluster has no tasks
     */
    public List<Task> clusterTasks(String clusterName) {
        List<Task> tasks = taskRepository.findByCluster(clusterName);
        if (tasks.isEmpty()) {
            throw new NotFoundException("Tasks of cluster", clusterName);
        }
        return tasks;
    }

    private CloudAccount account(Kube kube) {
        return accountRepository.findByName(kube.accountName())
            .orElseThrow(() -> new NotFoundException("CloudAccount", kube.accountName()));
    }

    private TaskRun start(String workflowKind, TaskConfig config, CancellationToken token) {
        config.validate();
        Task task = taskEngine.create(workflowKind);
        OutputStream sink;
        try {
            sink = logSinkFactory.open(task.id());
        } catch (IOException e) {
            throw new StorageException("Cannot open log sink for task " + task.id(), e);
        }
        return taskEngine.run(task, config, sink, token);
    }
}
