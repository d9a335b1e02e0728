package com.controlplane.engine.persistence;

import com.controlplane.core.model.Task;
import com.controlplane.core.repository.KeyValueStore;
import com.controlplane.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * TaskRepository over the key-value store, one JSON record per task under {@value #PREFIX}.
 * Credentials in the task config are stripped before a record is written.
 */
public class KeyValueTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(KeyValueTaskRepository.class);

    public static final String PREFIX = "/task/";

    private final KeyValueStore store;
    private final JsonCodec codec;

    public KeyValueTaskRepository(KeyValueStore store, JsonCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public void save(Task task) {
        store.put(PREFIX, task.id(), codec.encode(task.redacted()));
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return store.get(PREFIX, taskId)
            .map(entry -> codec.decode(entry.value(), Task.class));
    }

    @Override
    public List<Task> findAll() {
        return store.list(PREFIX).stream()
            .map(data -> codec.decode(data, Task.class))
            .sorted(Comparator.comparing(Task::createdAt))
            .toList();
    }

    @Override
    public List<Task> findByCluster(String clusterName) {
        return findAll().stream()
            .filter(task -> task.belongsTo(clusterName))
            .toList();
    }

    @Override
    public boolean delete(String taskId) {
        return store.delete(PREFIX, taskId);
    }

    @Override
    public int deleteByCluster(String clusterName) {
        int deleted = 0;
        for (Task task : findByCluster(clusterName)) {
            if (store.delete(PREFIX, task.id())) {
                deleted++;
            } else {
                log.warn("Task {} of cluster {} was already gone", task.id(), clusterName);
            }
        }
        return deleted;
    }
}
