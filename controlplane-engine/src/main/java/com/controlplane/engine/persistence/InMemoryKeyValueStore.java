package com.controlplane.engine.persistence;

import com.controlplane.core.repository.KeyValueStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of KeyValueStore.
 * Revisions come from one store-wide counter, so every write gets a fresh revision.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong revision = new AtomicLong();

    private record Key(String prefix, String id) {
    }

    @Override
    public List<byte[]> list(String prefix) {
        return entries.entrySet().stream()
            .filter(e -> e.getKey().prefix().equals(prefix))
            .map(e -> e.getValue().value().clone())
            .toList();
    }

    @Override
    public Optional<Entry> get(String prefix, String id) {
        Entry entry = entries.get(new Key(prefix, id));
        return entry == null ? Optional.empty() : Optional.of(new Entry(entry.value().clone(), entry.version()));
    }

    @Override
    public void put(String prefix, String id, byte[] value) {
        entries.put(new Key(prefix, id), new Entry(value.clone(), revision.incrementAndGet()));
    }

    @Override
    public boolean putIfVersion(String prefix, String id, byte[] value, long expectedVersion) {
        boolean[] written = new boolean[1];
        entries.compute(new Key(prefix, id), (key, current) -> {
            long currentVersion = current == null ? 0L : current.version();
            if (currentVersion != expectedVersion) {
                return current;
            }
            written[0] = true;
            return new Entry(value.clone(), revision.incrementAndGet());
        });
        return written[0];
    }

    @Override
    public boolean delete(String prefix, String id) {
        return entries.remove(new Key(prefix, id)) != null;
    }
}
