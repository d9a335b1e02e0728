package com.controlplane.engine.persistence;

import com.controlplane.core.exception.DuplicateClusterException;
import com.controlplane.core.model.Kube;
import com.controlplane.core.model.Versioned;
import com.controlplane.core.repository.KeyValueStore;
import com.controlplane.core.repository.KubeRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * KubeRepository over the key-value store under {@value #PREFIX}.
 */
public class KeyValueKubeRepository implements KubeRepository {

    public static final String PREFIX = "/kube/";

    private final KeyValueStore store;
    private final JsonCodec codec;

    public KeyValueKubeRepository(KeyValueStore store, JsonCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public void create(Kube kube) {
        if (!store.putIfVersion(PREFIX, kube.name(), codec.encode(kube), 0L)) {
            throw new DuplicateClusterException(kube.name());
        }
    }

    @Override
    public Optional<Versioned<Kube>> findByName(String name) {
        return store.get(PREFIX, name)
            .map(entry -> new Versioned<>(codec.decode(entry.value(), Kube.class), entry.version()));
    }

    @Override
    public List<Kube> findAll() {
        return store.list(PREFIX).stream()
            .map(data -> codec.decode(data, Kube.class))
            .sorted(Comparator.comparing(Kube::name))
            .toList();
    }

    @Override
    public boolean compareAndSet(Kube kube, long expectedVersion) {
        return store.putIfVersion(PREFIX, kube.name(), codec.encode(kube), expectedVersion);
    }

    @Override
    public boolean delete(String name) {
        return store.delete(PREFIX, name);
    }
}
