package com.controlplane.engine.service;

import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.OperationNotAllowedException;
import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeProfile;
import com.controlplane.core.model.RetryPolicy;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskOutcome;
import com.controlplane.core.model.TaskStatus;
import com.controlplane.core.step.Step;
import com.controlplane.engine.execution.TaskEngine;
import com.controlplane.engine.execution.TaskRun;
import com.controlplane.engine.logsink.FileLogSinkFactory;
import com.controlplane.engine.metrics.TaskMetrics;
import com.controlplane.engine.persistence.InMemoryKeyValueStore;
import com.controlplane.engine.persistence.JsonCodec;
import com.controlplane.engine.persistence.KeyValueCloudAccountRepository;
import com.controlplane.engine.persistence.KeyValueKubeRepository;
import com.controlplane.engine.persistence.KeyValueTaskRepository;
import com.controlplane.engine.provisioner.NodeProvisioner;
import com.controlplane.engine.support.Fixtures;
import com.controlplane.engine.support.ScriptedStep;
import com.controlplane.engine.workflow.StepRegistry;
import com.controlplane.engine.workflow.WorkflowRegistry;
import com.controlplane.engine.workflow.Workflows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class ClusterLifecycleServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path logDir;

    private KeyValueTaskRepository tasks;
    private KeyValueCloudAccountRepository accounts;
    private ClusterService clusters;
    private ExecutorService taskExecutor;
    private ExecutorService stepExecutor;
    private CompletionReactor reactor;
    private final List<Step> steps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        JsonCodec codec = JsonCodec.createDefault();
        tasks = new KeyValueTaskRepository(store, codec);
        accounts = new KeyValueCloudAccountRepository(store, codec);
        accounts.save(Fixtures.account());
        clusters = new ClusterService(new KeyValueKubeRepository(store, codec), 10);
        taskExecutor = Executors.newFixedThreadPool(4);
        stepExecutor = Executors.newCachedThreadPool();
        reactor = new CompletionReactor(RetryPolicy.noRetry(), Executors.newSingleThreadScheduledExecutor(),
            new TaskMetrics());

        for (String name : List.of(Workflows.DO_DELETE_MACHINES, Workflows.DO_DELETE_KEYS,
                Workflows.DO_DETACH_LOAD_BALANCER, Workflows.DO_DELETE_MACHINE, Workflows.REMOVE_FROM_INVENTORY,
                Workflows.DO_CREATE_MACHINE, Workflows.INSTALL_DOCKER, Workflows.INSTALL_KUBELET,
                Workflows.JOIN_CLUSTER)) {
            steps.add(ScriptedStep.succeeding(name));
        }
    }

    @AfterEach
    void tearDown() {
        reactor.shutdown();
        taskExecutor.shutdownNow();
        stepExecutor.shutdownNow();
    }

    private ClusterLifecycleService service() {
        WorkflowRegistry registry = Workflows.defaultRegistry();
        TaskMetrics metrics = new TaskMetrics();
        TaskEngine engine = new TaskEngine(registry, new StepRegistry(steps), tasks,
            taskExecutor, stepExecutor, metrics);
        FileLogSinkFactory sinks = new FileLogSinkFactory(logDir);
        NodeProvisioner provisioner = new NodeProvisioner(registry, engine, sinks, clusters, reactor);
        return new ClusterLifecycleService(clusters, accounts, registry, engine, tasks, sinks, reactor,
            provisioner, Duration.ofMinutes(10));
    }

    private void replaceStep(ScriptedStep replacement) {
        steps.removeIf(step -> step.name().equals(replacement.name()));
        steps.add(replacement);
    }

    // ========== Delete cluster ==========

    @Test
    @DisplayName("Successful teardown removes the cluster record and its tasks")
    void testDeleteCluster() throws Exception {
        clusters.create(Fixtures.kube("alpha"));
        clusters.create(Fixtures.kube("beta"));
        ClusterLifecycleService service = service();
        service.addNodes("beta", List.of(new NodeProfile("s-2vcpu-4gb", null, null)));

        TaskRun run = service.deleteCluster("alpha");
        assertThat(run.await(WAIT).succeeded()).isTrue();

        await().atMost(WAIT).untilAsserted(() -> {
            assertThat(clusters.list()).extracting(Kube::name).containsExactly("beta");
            assertThat(tasks.findByCluster("alpha")).isEmpty();
        });
        assertThat(tasks.findByCluster("beta")).hasSize(1);
    }

    @Test
    @DisplayName("Failed teardown keeps the cluster record and the failed task")
    void testDeleteClusterFailure() throws Exception {
        clusters.create(Fixtures.kube("alpha"));
        replaceStep(ScriptedStep.failing(Workflows.DO_DELETE_KEYS, "key in use"));
        ClusterLifecycleService service = service();

        TaskOutcome outcome = service.deleteCluster("alpha").await(WAIT);

        assertThat(outcome.failedStep()).isEqualTo(Workflows.DO_DELETE_KEYS);
        assertThat(clusters.get("alpha")).isNotNull();
        Task task = service.clusterTasks("alpha").get(0);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILURE);
    }

    @Test
    @DisplayName("Provider without a teardown workflow is reported as not found")
    void testDeleteClusterUnsupportedProvider() {
        accounts.save(new CloudAccount("gce", CloudProvider.GCE, Map.of("json", "{}")));
        Kube kube = Fixtures.kube("alpha");
        clusters.create(new Kube("alpha", "gce", CloudProvider.GCE, kube.profile(), kube.masters(), kube.nodes()));

        assertThatThrownBy(() -> service().deleteCluster("alpha"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("GCE");
        assertThat(tasks.findAll()).isEmpty();
    }

    @Test
    void testDeleteUnknownCluster() {
        assertThatThrownBy(() -> service().deleteCluster("ghost"))
            .isInstanceOf(NotFoundException.class);
    }

    // ========== Delete node ==========

    @Test
    @DisplayName("Successful node deletion removes the node from the record")
    void testDeleteNode() throws Exception {
        clusters.create(Fixtures.kube("alpha"));

        TaskRun run = service().deleteNode("alpha", "alpha-worker-1");
        assertThat(run.await(WAIT).succeeded()).isTrue();

        await().atMost(WAIT).untilAsserted(() ->
            assertThat(clusters.get("alpha").hasNode("alpha-worker-1")).isFalse());
        assertThat(tasks.findById(run.taskId()).orElseThrow().config().node().name()).isEqualTo("alpha-worker-1");
    }

    @Test
    @DisplayName("Failed node deletion leaves the node recorded")
    void testDeleteNodeFailure() throws Exception {
        clusters.create(Fixtures.kube("alpha"));
        replaceStep(ScriptedStep.failing(Workflows.DO_DELETE_MACHINE, "quota exceeded"));

        TaskOutcome outcome = service().deleteNode("alpha", "alpha-worker-1").await(WAIT);

        assertThat(outcome.status()).isEqualTo(TaskStatus.FAILURE);
        assertThat(clusters.get("alpha").hasNode("alpha-worker-1")).isTrue();
    }

    @Test
    @DisplayName("Masters cannot be deleted; unknown nodes are not found")
    void testDeleteNodeRejected() {
        clusters.create(Fixtures.kube("alpha"));
        ClusterLifecycleService service = service();

        assertThatThrownBy(() -> service.deleteNode("alpha", "alpha-master-1"))
            .isInstanceOf(OperationNotAllowedException.class);
        assertThatThrownBy(() -> service.deleteNode("alpha", "alpha-worker-9"))
            .isInstanceOf(NotFoundException.class);
        assertThat(tasks.findAll()).isEmpty();
    }

    // ========== Add nodes ==========

    @Test
    @DisplayName("Added nodes join against the cluster's master")
    void testAddNodes() {
        clusters.create(Fixtures.kube("alpha"));

        List<String> ids = service().addNodes("alpha", List.of(
            new NodeProfile("s-2vcpu-4gb", null, null),
            new NodeProfile("s-2vcpu-4gb", null, null)));

        assertThat(ids).hasSize(2);
        await().atMost(WAIT).untilAsserted(() -> assertThat(clusters.get("alpha").nodes()).hasSize(3));
        assertThat(tasks.findById(ids.get(0)).orElseThrow().config().master().name()).isEqualTo("alpha-master-1");
    }

    @Test
    @DisplayName("Cluster without a master cannot grow")
    void testAddNodesWithoutMaster() {
        Kube kube = Fixtures.kube("alpha");
        clusters.create(new Kube("alpha", kube.accountName(), kube.provider(), kube.profile(), Map.of(), kube.nodes()));

        assertThatThrownBy(() -> service().addNodes("alpha", List.of(new NodeProfile("s-2vcpu-4gb", null, null))))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("Master");
    }

    // ========== Tasks ==========

    @Test
    @DisplayName("Cluster without tasks is reported as not found")
    void testClusterTasksEmpty() {
        clusters.create(Fixtures.kube("alpha"));

        assertThatThrownBy(() -> service().clusterTasks("alpha"))
            .isInstanceOf(NotFoundException.class);
    }
}
