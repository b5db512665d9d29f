package io.mnemo.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.model.Relation;
import io.mnemo.core.result.ErrorKind;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.ResultCache;
import java.nio.file.Path;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchOperationsTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private KnowledgeGraphStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStores.open(tempDir, clock);
        store.createEntities(List.of(
            Entity.of("alice", "person", List.of("likes tea")),
            Entity.of("bob", "person", List.of())
        )).orElseThrow();
        store.createRelations(List.of(Relation.of("alice", "bob", "knows"))).orElseThrow();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldReturnMatchedEntitiesWithTheirRelations() throws Exception {
        KnowledgeGraph byName = store.searchNodes("alice").orElseThrow();
        KnowledgeGraph byType = store.searchNodes("person").orElseThrow();

        assertThat(byName.entities()).extracting(Entity::name).containsExactly("alice");
        assertThat(byName.relations()).extracting(Relation::relationType).containsExactly("knows");
        assertThat(byType.entities()).extracting(Entity::name).containsExactlyInAnyOrder("alice", "bob");
        assertThat(byType.relations()).extracting(Relation::relationType).containsExactly("knows");
    }

    @Test
    void shouldOpenExactlyTheNamedNodes() throws Exception {
        KnowledgeGraph graph = store.openNodes(List.of("alice", "bob", "nobody")).orElseThrow();

        assertThat(graph.entities()).extracting(Entity::name).containsExactlyInAnyOrder("alice", "bob");
        assertThat(graph.relations()).hasSize(1);
        assertThat(graph.relations().get(0).from()).isEqualTo("alice");
        assertThat(graph.relations().get(0).to()).isEqualTo("bob");
        assertThat(store.openNodes(List.of()).orElseThrow().entities()).isEmpty();
    }

    @Test
    void shouldMatchCaseInsensitivelyOnNameTypeAndObservations() throws Exception {
        assertThat(store.searchNodes("ALICE").orElseThrow().entities()).extracting(Entity::name).containsExactly("alice");
        assertThat(store.searchNodes("Tea").orElseThrow().entities()).extracting(Entity::name).containsExactly("alice");
        assertThat(store.searchNodes("PERS").orElseThrow().entities()).hasSize(2);
        assertThat(store.searchNodes("nothing-here").orElseThrow().entities()).isEmpty();
    }

    @Test
    void shouldTreatWildcardsLiterally() throws Exception {
        store.createEntities(List.of(Entity.of("100%_done", "task", List.of()))).orElseThrow();

        assertThat(store.searchNodes("%").orElseThrow().entities()).extracting(Entity::name).containsExactly("100%_done");
        assertThat(store.searchNodes("_").orElseThrow().entities()).extracting(Entity::name).containsExactly("100%_done");
    }

    @Test
    void shouldRejectEmptyQuery() {
        assertThat(store.searchNodes("").error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(store.searchNodes("   ").error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(store.searchNodes(null).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void shouldRejectQueryMadeOnlyOfControlCharacters() {
        assertThat(store.searchNodes("\u0001").error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(store.searchNodes("\u0000\u0007 ").error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void shouldFoldNonAsciiCase() throws Exception {
        store.createEntities(List.of(Entity.of("ärger", "gefühl", List.of("Über alles")))).orElseThrow();

        assertThat(store.searchNodes("ÄRGER").orElseThrow().entities()).extracting(Entity::name).containsExactly("ärger");
        assertThat(store.searchNodes("GEFÜHL").orElseThrow().entities()).extracting(Entity::name).containsExactly("ärger");
        assertThat(store.searchNodes("über").orElseThrow().entities()).extracting(Entity::name).containsExactly("ärger");
    }

    @Test
    void shouldServeRepeatedSearchFromCache() throws Exception {
        ResultCache cache = store.context().resultCache();

        KnowledgeGraph first = store.searchNodes("alice").orElseThrow();
        long hitsBefore = cache.hits();
        KnowledgeGraph second = store.searchNodes("alice").orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(cache.hits()).isEqualTo(hitsBefore + 1);
        assertThat(store.metrics().operations().get("search_nodes").cacheHitRate()).isEqualTo(50.0);
    }

    @Test
    void shouldReflectWritesMadeThroughTheStore() throws Exception {
        store.searchNodes("carol").orElseThrow();

        store.createEntities(List.of(Entity.of("carol", "person", List.of()))).orElseThrow();

        assertThat(store.searchNodes("carol").orElseThrow().entities()).extracting(Entity::name).containsExactly("carol");
    }

    @Test
    void shouldReflectOutOfBandChangesOnlyAfterInvalidateAll() throws Exception {
        assertThat(store.searchNodes("dave").orElseThrow().entities()).isEmpty();
        try (PooledConnection handle = store.context().pool().acquire();
             Statement statement = handle.connection().createStatement()) {
            statement.executeUpdate("""
                INSERT INTO entities_recent (name, entity_type, observations, confidence_score, metadata, created_at, last_updated)
                VALUES ('dave', 'person', '[]', 1.0, '{}', 0, 0)
                """);
        }

        assertThat(store.searchNodes("dave").orElseThrow().entities()).isEmpty();
        store.context().resultCache().invalidateAll();
        assertThat(store.searchNodes("dave").orElseThrow().entities()).extracting(Entity::name).containsExactly("dave");
    }
}
