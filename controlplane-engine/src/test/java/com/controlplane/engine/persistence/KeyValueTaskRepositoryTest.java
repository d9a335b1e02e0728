package com.controlplane.engine.persistence;

import com.controlplane.core.model.Task;
import com.controlplane.core.model.WorkflowDefinition;
import com.controlplane.engine.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class KeyValueTaskRepositoryTest {

    private static final WorkflowDefinition DELETE_CLUSTER = WorkflowDefinition.builder("DigitalOceanDeleteCluster")
        .step("do_delete_machines")
        .step("do_delete_keys")
        .build();

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    private final KeyValueTaskRepository repository = new KeyValueTaskRepository(store, JsonCodec.createDefault());

    private Task taskOf(String cluster) {
        Task task = Task.create(DELETE_CLUSTER).withConfig(Fixtures.config(cluster));
        repository.save(task);
        return task;
    }

    @Test
    @DisplayName("Saved task reads back with its steps and config")
    void testRoundTrip() {
        Task task = taskOf("alpha");

        Task loaded = repository.findById(task.id()).orElseThrow();

        assertThat(loaded.id()).isEqualTo(task.id());
        assertThat(loaded.workflowKind()).isEqualTo("DigitalOceanDeleteCluster");
        assertThat(loaded.stepStatuses()).isEqualTo(task.stepStatuses());
        assertThat(loaded.config().profile()).isEqualTo(Fixtures.profile());
    }

    @Test
    @DisplayName("Credentials never reach the store")
    void testCredentialsRedacted() {
        Task task = taskOf("alpha");

        byte[] raw = store.get(KeyValueTaskRepository.PREFIX, task.id()).orElseThrow().value();

        assertThat(new String(raw, StandardCharsets.UTF_8)).doesNotContain(Fixtures.SECRET);
        assertThat(repository.findById(task.id()).orElseThrow().config().credentials()).isEmpty();
    }

    @Test
    @DisplayName("Cluster lookup matches the cluster name exactly")
    void testFindByCluster() {
        Task a1 = taskOf("alpha");
        Task a2 = taskOf("alpha");
        taskOf("alpha-2");
        taskOf("beta");
        repository.save(Task.create(DELETE_CLUSTER));

        assertThat(repository.findByCluster("alpha")).extracting(Task::id)
            .containsExactlyInAnyOrder(a1.id(), a2.id());
        assertThat(repository.findByCluster("gamma")).isEmpty();
    }

    @Test
    @DisplayName("Deleting a cluster's tasks leaves other clusters alone")
    void testDeleteByCluster() {
        taskOf("alpha");
        taskOf("alpha");
        Task beta = taskOf("beta");

        assertThat(repository.deleteByCluster("alpha")).isEqualTo(2);

        assertThat(repository.findByCluster("alpha")).isEmpty();
        assertThat(repository.findAll()).extracting(Task::id).containsExactly(beta.id());
        assertThat(repository.deleteByCluster("alpha")).isZero();
    }

    @Test
    void testDelete() {
        Task task = taskOf("alpha");

        assertThat(repository.delete(task.id())).isTrue();
        assertThat(repository.delete(task.id())).isFalse();
        assertThat(repository.findById(task.id())).isEmpty();
    }
}
