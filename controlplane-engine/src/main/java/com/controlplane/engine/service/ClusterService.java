package com.controlplane.engine.service;

import com.controlplane.core.exception.NotFoundException;
import com.controlplane.core.exception.OptimisticLockException;
import com.controlplane.core.exception.ValidationException;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.Versioned;
import com.controlplane.core.repository.KubeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Reads and mutates cluster records.
 *
 * Every mutation is read-modify-compare-and-swap on the record revision: a writer that
 * loses the race re-reads and re-applies its change instead of overwriting the winner.
 */
public class ClusterService {

    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    private final KubeRepository kubeRepository;
    private final int maxUpdateAttempts;

    public ClusterService(KubeRepository kubeRepository, int maxUpdateAttempts) {
        if (maxUpdateAttempts < 1) {
            throw new IllegalArgumentException("maxUpdateAttempts must be >= 1");
        }
        this.kubeRepository = kubeRepository;
        this.maxUpdateAttempts = maxUpdateAttempts;
    }

    public Kube create(Kube kube) {
        if (kube.name() == null || kube.name().isBlank()) {
            throw new ValidationException("name", "must not be blank");
        }
        if (kube.provider() == null) {
            throw new ValidationException("provider", "must not be null");
        }
        kubeRepository.create(kube);
        log.info("Created cluster {} on {}", kube.name(), kube.provider());
        return kube;
    }

    public Kube get(String name) {
        return kubeRepository.findByName(name)
            .map(Versioned::value)
            .orElseThrow(() -> new NotFoundException("Kube", name));
    }

    public List<Kube> list() {
        return kubeRepository.findAll();
    }

    /**
     * @return true if the record existed
     */
    public boolean delete(String name) {
        boolean deleted = kubeRepository.delete(name);
        if (deleted) {
            log.info("Deleted cluster record {}", name);
        }
        return deleted;
    }

    /**
     * Apply a change to the current record.
     *
     * @param name Cluster name
     * @param change Pure function of the current record; may be applied more than once
     * @return The record as stored
     * @throws NotFoundException if the cluster does not exist (or vanishes mid-update)
     * @throws OptimisticLockException if every attempt lost against a concurrent writer
     */
    public Kube update(String name, UnaryOperator<Kube> change) {
        for (int attempt = 1; attempt <= maxUpdateAttempts; attempt++) {
            Versioned<Kube> current = kubeRepository.findByName(name)
                .orElseThrow(() -> new NotFoundException("Kube", name));

            Kube updated = change.apply(current.value());
            if (updated.equals(current.value())) {
                return updated;
            }
            if (!updated.name().equals(name)) {
                throw new ValidationException("name", "cannot be changed by an update");
            }
            if (kubeRepository.compareAndSet(updated, current.version())) {
                log.debug("Updated cluster {} at revision {} (attempt {})", name, current.version(), attempt);
                return updated;
            }
            log.debug("Cluster {} changed concurrently, retrying update (attempt {})", name, attempt);
        }
        throw new OptimisticLockException("Kube", name, maxUpdateAttempts);
    }
}
