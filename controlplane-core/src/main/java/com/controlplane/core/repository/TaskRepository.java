package com.controlplane.core.repository;

import com.controlplane.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Task records.
 */
public interface TaskRepository {

    /**
     * Insert or replace a task record.
     *
     * @param task The task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Every persisted task.
     */
    List<Task> findAll();

    /**
     * Find every task whose config references a cluster.
     * There is no secondary index: this scans the whole task namespace.
     *
     * @param clusterName The cluster name
     * @return Tasks of that cluster, oldest first
     */
    List<Task> findByCluster(String clusterName);

    /**
     * Delete a task.
     *
     * @return true if the task existed
     */
    boolean delete(String taskId);

    /**
     * Delete every task of a cluster.
     *
     * @return Number of tasks removed
     */
    int deleteByCluster(String clusterName);
}
