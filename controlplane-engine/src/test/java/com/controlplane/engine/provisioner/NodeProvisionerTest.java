package com.controlplane.engine.provisioner;

import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.NodeProfile;
import com.controlplane.core.model.NodeRole;
import com.controlplane.core.model.Task;
import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.model.TaskStatus;
import com.controlplane.core.model.RetryPolicy;
import com.controlplane.core.step.CancellationToken;
import com.controlplane.core.step.Step;
import com.controlplane.engine.execution.TaskEngine;
import com.controlplane.engine.logsink.FileLogSinkFactory;
import com.controlplane.engine.metrics.TaskMetrics;
import com.controlplane.engine.persistence.InMemoryKeyValueStore;
import com.controlplane.engine.persistence.JsonCodec;
import com.controlplane.engine.persistence.KeyValueKubeRepository;
import com.controlplane.engine.persistence.KeyValueTaskRepository;
import com.controlplane.engine.service.ClusterService;
import com.controlplane.engine.service.CompletionReactor;
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

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class NodeProvisionerTest {

    @TempDir
    Path logDir;

    private KeyValueTaskRepository tasks;
    private ClusterService clusters;
    private ExecutorService taskExecutor;
    private ExecutorService stepExecutor;
    private CompletionReactor reactor;
    private NodeProvisioner provisioner;
    private TaskEngine engine;

    @BeforeEach
    void setUp() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        JsonCodec codec = JsonCodec.createDefault();
        tasks = new KeyValueTaskRepository(store, codec);
        clusters = new ClusterService(new KeyValueKubeRepository(store, codec), 10);
        taskExecutor = Executors.newFixedThreadPool(4);
        stepExecutor = Executors.newCachedThreadPool();
        TaskMetrics metrics = new TaskMetrics();

        List<Step> steps = List.of(
            ScriptedStep.succeeding(Workflows.DO_CREATE_MACHINE),
            ScriptedStep.succeeding(Workflows.INSTALL_DOCKER),
            ScriptedStep.succeeding(Workflows.INSTALL_KUBELET),
            new ScriptedStep(Workflows.JOIN_CLUSTER, ctx -> ctx.log("joining %s via %s",
                ctx.getConfig().node().name(), ctx.getConfig().master().name())));
        WorkflowRegistry registry = Workflows.defaultRegistry();
        engine = new TaskEngine(registry, new StepRegistry(steps), tasks, taskExecutor, stepExecutor, metrics);
        reactor = new CompletionReactor(RetryPolicy.noRetry(), Executors.newSingleThreadScheduledExecutor(), metrics);
        provisioner = new NodeProvisioner(registry, engine, new FileLogSinkFactory(logDir), clusters, reactor);
    }

    @AfterEach
    void tearDown() {
        reactor.shutdown();
        taskExecutor.shutdownNow();
        stepExecutor.shutdownNow();
    }

    private TaskConfig configFor(Kube kube) {
        return TaskConfig.forCluster(kube, Fixtures.account()).withMaster(kube.anyMaster().orElseThrow());
    }

    @Test
    @DisplayName("One task per profile; every provisioned node is added to the cluster")
    void testProvisionNodes() {
        Kube kube = clusters.create(Fixtures.kube("alpha"));
        List<NodeProfile> profiles = List.of(
            new NodeProfile("s-2vcpu-4gb", "ubuntu-22-04-x64", null),
            new NodeProfile("s-4vcpu-8gb", "ubuntu-22-04-x64", NodeRole.WORKER),
            new NodeProfile("s-4vcpu-8gb", "ubuntu-22-04-x64", NodeRole.WORKER));

        List<String> ids = provisioner.provisionNodes(CancellationToken.create(), profiles, kube, configFor(kube));

        assertThat(ids).hasSize(3).doesNotHaveDuplicates();
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
            assertThat(clusters.get("alpha").nodes()).hasSize(4));

        for (String id : ids) {
            Task task = tasks.findById(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.SUCCESS);
            assertThat(task.workflowKind()).isEqualTo(Workflows.DIGITALOCEAN_PROVISION_NODE);
            assertThat(task.config().node().name()).startsWith("alpha-worker-");
            assertThat(task.config().nodeProfile()).isNotNull();
            assertThat(clusters.get("alpha").hasNode(task.config().node().name())).isTrue();
        }
        assertThat(tasks.findByCluster("alpha")).hasSize(3);
    }

    @Test
    @DisplayName("Step output lands in one log file per task")
    void testLogFiles() throws Exception {
        Kube kube = clusters.create(Fixtures.kube("alpha"));

        String id = provisioner.provisionNodes(CancellationToken.create(),
            List.of(new NodeProfile("s-2vcpu-4gb", null, null)), kube, configFor(kube)).get(0);

        await().atMost(Duration.ofSeconds(10)).until(() ->
            tasks.findById(id).map(t -> t.status().isTerminal()).orElse(false));
        assertThat(Files.readString(logDir.resolve(id + ".log")))
            .contains("[join_cluster] joining alpha-worker-", "via alpha-master-1");
    }

    @Test
    @DisplayName("Empty profile list and missing master are rejected")
    void testValidation() {
        Kube kube = clusters.create(Fixtures.kube("alpha"));
        TaskConfig noMaster = TaskConfig.forCluster(kube, Fixtures.account());

        assertThatThrownBy(() -> provisioner.provisionNodes(CancellationToken.create(), List.of(), kube,
            configFor(kube))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> provisioner.provisionNodes(CancellationToken.create(),
            List.of(new NodeProfile("s-2vcpu-4gb", null, null)), kube, noMaster))
            .isInstanceOf(ValidationException.class);
        assertThat(tasks.findAll()).isEmpty();
    }

    @Test
    @DisplayName("Blank cluster name or missing provider is rejected before any task is created")
    void testMalformedConfig() throws Exception {
        Kube kube = clusters.create(Fixtures.kube("alpha"));
        TaskConfig valid = configFor(kube);
        TaskConfig blankName = new TaskConfig("", valid.cloudAccountName(), valid.provider(),
            valid.credentials(), valid.profile(), valid.master(), null, null);
        TaskConfig noProvider = new TaskConfig("alpha", valid.cloudAccountName(), null,
            valid.credentials(), valid.profile(), valid.master(), null, null);
        List<NodeProfile> profiles = List.of(new NodeProfile("s-2vcpu-4gb", null, null));

        assertThatThrownBy(() -> provisioner.provisionNodes(CancellationToken.create(), profiles, kube, blankName))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("config.clusterName");
        assertThatThrownBy(() -> provisioner.provisionNodes(CancellationToken.create(), profiles, kube, noProvider))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("config.provider");

        assertThat(tasks.findAll()).isEmpty();
        try (Stream<Path> files = Files.list(logDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("Provider without a provisioning workflow fails before any task is created")
    void testUnsupportedProvider() {
        Kube kube = Fixtures.kube("alpha");
        CloudAccount aws = new CloudAccount("aws", CloudProvider.AWS, Map.of("key", "x"));
        TaskConfig config = TaskConfig.forCluster(kube, aws).withMaster(kube.anyMaster().orElseThrow());

        assertThatThrownBy(() -> provisioner.provisionNodes(CancellationToken.create(),
            List.of(new NodeProfile("m5.large", null, null)), kube, config))
            .isInstanceOf(NotFoundException.class);
        assertThat(tasks.findAll()).isEmpty();
    }
}
