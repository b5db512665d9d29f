package io.mnemo.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.Relation;
import io.mnemo.core.model.RelationKey;
import io.mnemo.core.result.ErrorKind;
import io.mnemo.core.result.StoreResult;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelationOperationsTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private KnowledgeGraphStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStores.open(tempDir, clock);
        store.createEntities(List.of(
            Entity.of("alice", "person", List.of()),
            Entity.of("bob", "person", List.of())
        )).orElseThrow();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldCreateRelationWithDefaultValidity() throws Exception {
        List<Relation> created = store.createRelations(List.of(Relation.of("alice", "bob", "knows"))).orElseThrow();

        assertThat(created).hasSize(1);
        Relation relation = created.get(0);
        assertThat(relation.createdAt()).isEqualTo(clock.instant());
        assertThat(relation.validFrom()).isEqualTo(clock.instant());
        assertThat(relation.validUntil()).isNull();
        assertThat(relation.confidenceScore()).isEqualTo(1.0);
    }

    @Test
    void shouldSkipExactDuplicates() throws Exception {
        store.createRelations(List.of(Relation.of("alice", "bob", "knows"))).orElseThrow();

        List<Relation> second = store.createRelations(List.of(
            Relation.of("alice", "bob", "knows"),
            Relation.of("alice", "bob", "works_with")
        )).orElseThrow();

        assertThat(second).extracting(Relation::relationType).containsExactly("works_with");
        assertThat(store.readGraph().orElseThrow().relations()).hasSize(2);
    }

    @Test
    void shouldNameTheMissingEndpoint() {
        StoreResult<List<Relation>> result = store.createRelations(List.of(
            Relation.of("alice", "bob", "knows"),
            Relation.of("alice", "zed", "knows")
        ));

        assertThat(result.error().kind()).isEqualTo(ErrorKind.ENTITY_NOT_FOUND);
        assertThat(result.error().message()).contains("zed");
    }

    @Test
    void shouldNotPersistAnyRelationWhenOneEndpointIsMissing() throws Exception {
        store.createRelations(List.of(
            Relation.of("alice", "bob", "knows"),
            Relation.of("ghost", "bob", "haunts")
        ));

        assertThat(store.readGraph().orElseThrow().relations()).isEmpty();
    }

    @Test
    void shouldRejectInvertedValidityInterval() {
        Relation inverted = new Relation(
            "alice", "bob", "knows", null, null, null,
            Instant.parse("2026-03-02T00:00:00Z"),
            Instant.parse("2026-03-01T00:00:00Z")
        );

        assertThat(store.createRelations(List.of(inverted)).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void shouldDeleteRelationsIdempotently() throws Exception {
        store.createRelations(List.of(Relation.of("alice", "bob", "knows"))).orElseThrow();
        RelationKey key = new RelationKey("alice", "bob", "knows");

        assertThat(store.deleteRelations(List.of(key)).orElseThrow()).containsExactly(key);
        assertThat(store.deleteRelations(List.of(key)).orElseThrow()).isEmpty();
        assertThat(store.readGraph().orElseThrow().relations()).isEmpty();
    }
}
