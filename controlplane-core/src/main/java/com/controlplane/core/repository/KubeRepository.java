package com.controlplane.core.repository;

import com.controlplane.core.model.Kube;
import com.controlplane.core.model.Versioned;

import java.util.List;
import java.util.Optional;

/**
 * Repository for cluster records.
 */
public interface KubeRepository {

    /**
     * Store a new cluster.
     *
     * @throws com.controlplane.core.exception.DuplicateClusterException if the name is taken
     */
    void create(Kube kube);

    Optional<Versioned<Kube>> findByName(String name);

    List<Kube> findAll();

    /**
     * Replace a cluster record if it has not changed since it was read.
     *
     * @param kube The replacement record
     * @param expectedVersion Revision the caller read
     * @return false if a concurrent writer changed or removed the record
     */
    boolean compareAndSet(Kube kube, long expectedVersion);

    boolean delete(String name);
}
