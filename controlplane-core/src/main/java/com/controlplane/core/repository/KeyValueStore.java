package com.controlplane.core.repository;

import java.util.List;
import java.util.Optional;

/**
 * Byte-oriented durable store keyed by a namespace prefix and an identifier.
 * Callers decide how records are encoded; the store imposes no schema.
 *
 * Every write is a single record; there are no multi-record transactions.
 * Implementations report an unavailable backend with {@link com.controlplane.core.exception.StorageException}.
 */
public interface KeyValueStore {

    /**
     * List every record stored under exactly this prefix. Prefixes are namespaces,
     * not string prefixes: {@code /task/} does not match records under {@code /task/archive/}.
     *
     * @param prefix The namespace, e.g. {@code /task/}
     * @return Raw records, in no particular order
     */
    List<byte[]> list(String prefix);

    /**
     * Read one record.
     *
     * @param prefix The namespace
     * @param id The record identifier
     * @return The record and its current revision, or empty if absent
     */
    Optional<Entry> get(String prefix, String id);

    /**
     * Write a record unconditionally.
     */
    void put(String prefix, String id, byte[] value);

    /**
     * Write a record only if its revision still matches.
     *
     * @param expectedVersion Revision last read, or 0 to require that the record does not exist
     * @return true if written, false if another writer got there first
     */
    boolean putIfVersion(String prefix, String id, byte[] value, long expectedVersion);

    /**
     * Delete a record.
     *
     * @return true if a record was removed, false if none existed
     */
    boolean delete(String prefix, String id);

    /**
     * A stored record with its revision. Revisions are positive, grow with every write
     * and are never handed out twice, not even after the record is deleted.
     */
    record Entry(byte[] value, long version) {
    }
}
