package com.controlplane.engine.persistence.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against an embedded H2 database.
 */
class JdbcKeyValueStoreTest {

    private EmbeddedDatabase database;
    private JdbcKeyValueStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .build();
        store = new JdbcKeyValueStore(new JdbcTemplate(database));
        store.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Schema creation is idempotent")
    void testInitializeTwice() {
        store.put("/task/", "1", bytes("a"));
        store.initializeSchema();

        assertThat(store.get("/task/", "1")).isPresent();
    }

    @Test
    @DisplayName("Put inserts then replaces, bumping the version")
    void testPutUpserts() {
        store.put("/task/", "1", bytes("a"));
        long v1 = store.get("/task/", "1").orElseThrow().version();
        store.put("/task/", "1", bytes("b"));

        var entry = store.get("/task/", "1").orElseThrow();
        assertThat(text(entry.value())).isEqualTo("b");
        assertThat(entry.version()).isGreaterThan(v1);
    }

    @Test
    @DisplayName("List is scoped to one prefix")
    void testList() {
        store.put("/task/", "1", bytes("a"));
        store.put("/task/", "2", bytes("b"));
        store.put("/kube/", "alpha", bytes("c"));

        assertThat(store.list("/task/")).extracting(JdbcKeyValueStoreTest::text)
            .containsExactlyInAnyOrder("a", "b");
    }

    @Test
    @DisplayName("A nested namespace is not part of its parent's listing")
    void testListIgnoresNestedPrefix() {
        store.put("/task/", "1", bytes("a"));
        store.put("/task/archive/", "2", bytes("b"));

        assertThat(store.list("/task/")).extracting(JdbcKeyValueStoreTest::text).containsExactly("a");
    }

    @Test
    @DisplayName("Revisions come from one sequence and survive delete and re-create")
    void testRevisionSurvivesRecreate() {
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("v1"), 0)).isTrue();
        long stale = store.get("/kube/", "alpha").orElseThrow().version();
        store.put("/task/", "1", bytes("other"));
        assertThat(store.get("/task/", "1").orElseThrow().version()).isGreaterThan(stale);

        assertThat(store.delete("/kube/", "alpha")).isTrue();
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("again"), 0)).isTrue();

        assertThat(store.get("/kube/", "alpha").orElseThrow().version()).isGreaterThan(stale);
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("stale"), stale)).isFalse();
        assertThat(text(store.get("/kube/", "alpha").orElseThrow().value())).isEqualTo("again");
    }

    @Test
    @DisplayName("Conditional put enforces the expected version")
    void testPutIfVersion() {
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("v1"), 0)).isTrue();
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("dup"), 0)).isFalse();

        long version = store.get("/kube/", "alpha").orElseThrow().version();
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("v2"), version)).isTrue();
        assertThat(store.putIfVersion("/kube/", "alpha", bytes("stale"), version)).isFalse();
        assertThat(store.putIfVersion("/kube/", "beta", bytes("nope"), 7)).isFalse();

        assertThat(text(store.get("/kube/", "alpha").orElseThrow().value())).isEqualTo("v2");
    }

    @Test
    void testDelete() {
        store.put("/kube/", "alpha", bytes("v1"));

        assertThat(store.delete("/kube/", "alpha")).isTrue();
        assertThat(store.delete("/kube/", "alpha")).isFalse();
    }
}
