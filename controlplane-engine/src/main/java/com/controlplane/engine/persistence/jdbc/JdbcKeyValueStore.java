package com.controlplane.engine.persistence.jdbc;

import com.controlplane.core.exception.StorageException;
import com.controlplane.core.repository.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.jdbc.support.incrementer.DataFieldMaxValueIncrementer;
import org.springframework.jdbc.support.incrementer.H2SequenceMaxValueIncrementer;
import org.springframework.jdbc.support.incrementer.PostgresSequenceMaxValueIncrementer;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational implementation of KeyValueStore, one row per record.
 * Works against PostgreSQL and H2. Revisions are drawn from one database sequence,
 * so a record deleted and created again never gets back a revision it had before.
 */
public class JdbcKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);

    static final String REVISION_SEQUENCE = "kv_revision";

    static final String SEQUENCE = "CREATE SEQUENCE IF NOT EXISTS " + REVISION_SEQUENCE;

    static final String SCHEMA = """
        CREATE TABLE IF NOT EXISTS kv_entries (
            prefix      VARCHAR(128)  NOT NULL,
            id          VARCHAR(255)  NOT NULL,
            entry_value BYTEA         NOT NULL,
            version     BIGINT        NOT NULL,
            updated_at  TIMESTAMP     NOT NULL,
            PRIMARY KEY (prefix, id)
        )
        """;

    private final JdbcTemplate jdbcTemplate;
    private final DataFieldMaxValueIncrementer revisions;

    public JdbcKeyValueStore(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, revisionIncrementer(jdbcTemplate.getDataSource()));
    }

    public JdbcKeyValueStore(JdbcTemplate jdbcTemplate, DataFieldMaxValueIncrementer revisions) {
        this.jdbcTemplate = jdbcTemplate;
        this.revisions = revisions;
    }

    /**
     * Sequence incrementer for the database behind the data source.
     *
     * @throws StorageException if the database is neither PostgreSQL nor H2
     */
    static DataFieldMaxValueIncrementer revisionIncrementer(DataSource dataSource) {
        String product;
        try {
            product = JdbcUtils.commonDatabaseName(
                JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getDatabaseProductName));
        } catch (MetaDataAccessException e) {
            throw new StorageException("Cannot detect the key-value database", e);
        }
        if ("H2".equals(product)) {
            return new H2SequenceMaxValueIncrementer(dataSource, REVISION_SEQUENCE);
        }
        if ("PostgreSQL".equals(product)) {
            return new PostgresSequenceMaxValueIncrementer(dataSource, REVISION_SEQUENCE);
        }
        throw new StorageException("Unsupported key-value database: " + product);
    }

    /**
     * Create the backing table if it does not exist yet.
     */
    public void initializeSchema() {
        try {
            jdbcTemplate.execute(SCHEMA);
            jdbcTemplate.execute(SEQUENCE);
            log.info("Key-value schema ready");
        } catch (DataAccessException e) {
            throw new StorageException("Failed to initialize key-value schema", e);
        }
    }

    @Override
    public List<byte[]> list(String prefix) {
        try {
            return jdbcTemplate.query(
                "SELECT entry_value FROM kv_entries WHERE prefix = ?",
                (rs, rowNum) -> rs.getBytes("entry_value"),
                prefix
            );
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list " + prefix, e);
        }
    }

    @Override
    public Optional<Entry> get(String prefix, String id) {
        try {
            List<Entry> rows = jdbcTemplate.query(
                "SELECT entry_value, version FROM kv_entries WHERE prefix = ? AND id = ?",
                (rs, rowNum) -> new Entry(rs.getBytes("entry_value"), rs.getLong("version")),
                prefix, id
            );
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + prefix + id, e);
        }
    }

    @Override
    public void put(String prefix, String id, byte[] value) {
        try {
            // update first, insert if absent; a concurrent insert means we lost the race to create, so update again
            if (update(prefix, id, value) > 0) {
                return;
            }
            try {
                insert(prefix, id, value);
            } catch (DuplicateKeyException e) {
                update(prefix, id, value);
            }
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write " + prefix + id, e);
        }
    }

    @Override
    public boolean putIfVersion(String prefix, String id, byte[] value, long expectedVersion) {
        try {
            if (expectedVersion == 0L) {
                try {
                    insert(prefix, id, value);
                    return true;
                } catch (DuplicateKeyException e) {
                    return false;
                }
            }
            int rows = jdbcTemplate.update(
                "UPDATE kv_entries SET entry_value = ?, version = ?, updated_at = ? " +
                "WHERE prefix = ? AND id = ? AND version = ?",
                value, revisions.nextLongValue(), Timestamp.from(Instant.now()), prefix, id, expectedVersion
            );
            return rows == 1;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write " + prefix + id, e);
        }
    }

    @Override
    public boolean delete(String prefix, String id) {
        try {
            return jdbcTemplate.update("DELETE FROM kv_entries WHERE prefix = ? AND id = ?", prefix, id) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete " + prefix + id, e);
        }
    }

    private int update(String prefix, String id, byte[] value) {
        return jdbcTemplate.update(
            "UPDATE kv_entries SET entry_value = ?, version = ?, updated_at = ? WHERE prefix = ? AND id = ?",
            value, revisions.nextLongValue(), Timestamp.from(Instant.now()), prefix, id
        );
    }

    private void insert(String prefix, String id, byte[] value) {
        jdbcTemplate.update(
            "INSERT INTO kv_entries (prefix, id, entry_value, version, updated_at) VALUES (?, ?, ?, ?, ?)",
            prefix, id, value, revisions.nextLongValue(), Timestamp.from(Instant.now())
        );
    }
}
