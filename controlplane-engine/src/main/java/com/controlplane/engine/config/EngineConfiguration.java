package com.controlplane.engine.config;

import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.repository.CloudAccountRepository;
import com.controlplane.core.repository.KeyValueStore;
import com.controlplane.core.repository.KubeRepository;
import com.controlplane.core.repository.TaskRepository;
import com.controlplane.core.step.LogSinkFactory;
import com.controlplane.core.step.Step;
import com.controlplane.engine.execution.TaskEngine;
import com.controlplane.engine.lifecycle.EngineShutdownHandler;
import com.controlplane.engine.logsink.FileLogSinkFactory;
import com.controlplane.engine.metrics.TaskMetrics;
import com.controlplane.engine.persistence.InMemoryKeyValueStore;
import com.controlplane.engine.persistence.JsonCodec;
import com.controlplane.engine.persistence.KeyValueCloudAccountRepository;
import com.controlplane.engine.persistence.KeyValueKubeRepository;
import com.controlplane.engine.persistence.KeyValueTaskRepository;
import com.controlplane.engine.persistence.jdbc.JdbcKeyValueStore;
import com.controlplane.engine.provisioner.NodeProvisioner;
import com.controlplane.engine.service.ClusterLifecycleService;
import com.controlplane.engine.service.ClusterService;
import com.controlplane.engine.service.CompletionReactor;
import com.controlplane.engine.workflow.StepRegistry;
import com.controlplane.engine.workflow.WorkflowRegistry;
import com.controlplane.engine.workflow.Workflows;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the task engine and the services around it.
 */
@Configuration
@EnableConfigurationProperties(ControlPlaneProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    // ========== Storage ==========

    @Bean
    @ConditionalOnProperty(prefix = "controlplane.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore() {
        log.info("Using in-memory key-value store; records do not survive a restart");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "controlplane.store", name = "type", havingValue = "jdbc")
    public KeyValueStore jdbcKeyValueStore(JdbcTemplate jdbcTemplate) {
        log.info("Using JDBC key-value store");
        JdbcKeyValueStore store = new JdbcKeyValueStore(jdbcTemplate);
        store.initializeSchema();
        return store;
    }

    @Bean
    public JsonCodec jsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JsonCodec(mapper) : JsonCodec.createDefault();
    }

    @Bean
    public TaskRepository taskRepository(KeyValueStore store, JsonCodec codec) {
        return new KeyValueTaskRepository(store, codec);
    }

    @Bean
    public KubeRepository kubeRepository(KeyValueStore store, JsonCodec codec) {
        return new KeyValueKubeRepository(store, codec);
    }

    @Bean
    public CloudAccountRepository cloudAccountRepository(KeyValueStore store, JsonCodec codec,
                                                         ControlPlaneProperties properties) {
        CloudAccountRepository repository = new KeyValueCloudAccountRepository(store, codec);
        for (ControlPlaneProperties.Account account : properties.accounts()) {
            repository.save(new CloudAccount(account.name(), account.provider(), account.credentials()));
            log.info("Registered cloud account {} ({})", account.name(), account.provider());
        }
        return repository;
    }

    // ========== Engine ==========

    @Bean
    public WorkflowRegistry workflowRegistry() {
        return Workflows.defaultRegistry();
    }

    @Bean
    public StepRegistry stepRegistry(ObjectProvider<Step> steps) {
        return new StepRegistry(steps.orderedStream().toList());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskExecutor(ControlPlaneProperties properties) {
        return Executors.newFixedThreadPool(properties.engine().workerThreads(), namedThreads("task-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stepExecutor() {
        return Executors.newCachedThreadPool(namedThreads("step-"));
    }

    @Bean
    public TaskEngine taskEngine(WorkflowRegistry workflowRegistry, StepRegistry stepRegistry,
                                 TaskRepository taskRepository,
                                 @Qualifier("taskExecutor") ExecutorService taskExecutor,
                                 @Qualifier("stepExecutor") ExecutorService stepExecutor,
                                 TaskMetrics metrics) {
        return new TaskEngine(workflowRegistry, stepRegistry, taskRepository, taskExecutor, stepExecutor, metrics);
    }

    @Bean
    public EngineShutdownHandler engineShutdownHandler(TaskEngine taskEngine,
                                                       @Qualifier("taskExecutor") ExecutorService taskExecutor,
                                                       @Qualifier("stepExecutor") ExecutorService stepExecutor,
                                                       ControlPlaneProperties properties) {
        return new EngineShutdownHandler(taskEngine, taskExecutor, stepExecutor,
            properties.engine().shutdownGrace());
    }

    @Bean
    public LogSinkFactory logSinkFactory(ControlPlaneProperties properties) {
        log.info("Task logs go to {}", properties.logs().directory().toAbsolutePath());
        return new FileLogSinkFactory(properties.logs().directory());
    }

    // ========== Cluster operations ==========

    @Bean(destroyMethod = "shutdown")
    public CompletionReactor completionReactor(ControlPlaneProperties properties, TaskMetrics metrics) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("reaction-"));
        return new CompletionReactor(properties.reactions().toRetryPolicy(), scheduler, metrics);
    }

    @Bean
    public ClusterService clusterService(KubeRepository kubeRepository, ControlPlaneProperties properties) {
        return new ClusterService(kubeRepository, properties.cluster().maxUpdateAttempts());
    }

    @Bean
    public NodeProvisioner nodeProvisioner(WorkflowRegistry workflowRegistry, TaskEngine taskEngine,
                                           LogSinkFactory logSinkFactory, ClusterService clusterService,
                                           CompletionReactor reactor) {
        return new NodeProvisioner(workflowRegistry, taskEngine, logSinkFactory, clusterService, reactor);
    }

    @Bean
    public ClusterLifecycleService clusterLifecycleService(
            ClusterService clusterService,
            CloudAccountRepository accountRepository,
            WorkflowRegistry workflowRegistry,
            TaskEngine taskEngine,
            TaskRepository taskRepository,
            LogSinkFactory logSinkFactory,
            CompletionReactor reactor,
            NodeProvisioner nodeProvisioner,
            ControlPlaneProperties properties) {
        return new ClusterLifecycleService(clusterService, accountRepository, workflowRegistry, taskEngine,
            taskRepository, logSinkFactory, reactor, nodeProvisioner, properties.provisioning().deadline());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
