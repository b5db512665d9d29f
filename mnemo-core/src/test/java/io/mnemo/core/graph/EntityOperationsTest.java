package io.mnemo.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.model.Category;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.model.ObservationAddition;
import io.mnemo.core.model.ObservationDeletion;
import io.mnemo.core.model.Relation;
import io.mnemo.core.result.ErrorKind;
import io.mnemo.core.result.StoreResult;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntityOperationsTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private KnowledgeGraphStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStores.open(tempDir, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldReturnCreatedEntitiesFromOpenNodes() throws Exception {
        Entity alice = new Entity("alice", "person", List.of("likes tea", "lives in Lisbon"), 0.8, "chat", Map.of("team", "core"), null, null, null);
        Entity bob = Entity.of("bob", "person", List.of());

        List<Entity> created = store.createEntities(List.of(alice, bob)).orElseThrow();
        KnowledgeGraph opened = store.openNodes(List.of("alice", "bob")).orElseThrow();

        assertThat(created).hasSize(2);
        assertThat(opened.entities()).hasSize(2);
        Entity storedAlice = opened.entities().stream().filter(e -> e.name().equals("alice")).findFirst().orElseThrow();
        assertThat(storedAlice.entityType()).isEqualTo("person");
        assertThat(storedAlice.observations()).containsExactly("likes tea", "lives in Lisbon");
        assertThat(storedAlice.confidenceScore()).isEqualTo(0.8);
        assertThat(storedAlice.contextSource()).isEqualTo("chat");
        assertThat(storedAlice.metadata()).containsEntry("team", "core");
        assertThat(storedAlice.createdAt()).isEqualTo(clock.instant());
        assertThat(storedAlice.lastUpdated()).isEqualTo(clock.instant());
    }

    @Test
    void shouldRejectDuplicateNameAndLeaveOriginalUntouched() throws Exception {
        store.createEntities(List.of(Entity.of("alice", "person", List.of("original")))).orElseThrow();

        StoreResult<List<Entity>> duplicate = store.createEntities(List.of(Entity.of("alice", "robot", List.of("impostor"))));

        assertThat(duplicate.isFailure()).isTrue();
        assertThat(duplicate.error().kind()).isEqualTo(ErrorKind.ENTITY_ALREADY_EXISTS);
        Entity stored = store.getEntity("alice").orElseThrow().orElseThrow();
        assertThat(stored.entityType()).isEqualTo("person");
        assertThat(stored.observations()).containsExactly("original");
    }

    @Test
    void shouldAbortWholeCallWhenAnyEntityAlreadyExists() throws Exception {
        store.createEntities(List.of(Entity.of("alice", "person", List.of()))).orElseThrow();

        StoreResult<List<Entity>> result = store.createEntities(
            List.of(Entity.of("carol", "person", List.of()), Entity.of("alice", "person", List.of())),
            1
        );

        assertThat(result.error().kind()).isEqualTo(ErrorKind.ENTITY_ALREADY_EXISTS);
        assertThat(store.getEntity("carol").orElseThrow()).isEmpty();
    }

    @Test
    void shouldRejectDuplicatesWithinOneCall() {
        StoreResult<List<Entity>> result = store.createEntities(List.of(
            Entity.of("dup", "thing", List.of()),
            Entity.of("dup", "thing", List.of())
        ));

        assertThat(result.error().kind()).isEqualTo(ErrorKind.ENTITY_ALREADY_EXISTS);
    }

    @Test
    void shouldRejectInvalidEntitiesBeforeWriting() throws Exception {
        assertThat(store.createEntities(List.of(Entity.of("  ", "person", List.of()))).error().kind())
            .isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(store.createEntities(List.of(Entity.of("ok", "", List.of()), Entity.of("x", "t", List.of()))).error().kind())
            .isEqualTo(ErrorKind.INVALID_ARGUMENT);
        Entity notANumber = new Entity("nan", "t", List.of(), Double.NaN, null, null, null, null, null);
        assertThat(store.createEntities(List.of(notANumber)).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);

        assertThat(store.readGraph().orElseThrow().entities()).isEmpty();
    }

    @Test
    void shouldClampConfidenceIntoUnitInterval() throws Exception {
        Entity high = new Entity("high", "t", List.of(), 1.7, null, null, null, null, null);
        Entity low = new Entity("low", "t", List.of(), -3.0, null, null, null, null, null);

        store.createEntities(List.of(high, low)).orElseThrow();

        assertThat(store.getEntity("high").orElseThrow().orElseThrow().confidenceScore()).isEqualTo(1.0);
        assertThat(store.getEntity("low").orElseThrow().orElseThrow().confidenceScore()).isEqualTo(0.0);
    }

    @Test
    void shouldAppendObservationsInOrder() throws Exception {
        store.createEntities(List.of(Entity.of("alice", "person", List.of("a", "b")))).orElseThrow();

        Map<String, List<String>> added = store.addObservations(List.of(new ObservationAddition("alice", List.of("c", "d")))).orElseThrow();
        store.addObservations(List.of(new ObservationAddition("alice", List.of("a")))).orElseThrow();

        assertThat(added).containsEntry("alice", List.of("c", "d"));
        assertThat(store.getEntity("alice").orElseThrow().orElseThrow().observations())
            .containsExactly("a", "b", "c", "d", "a");
    }

    @Test
    void shouldFailAddObservationsForUnknownEntityWithoutCreatingIt() throws Exception {
        StoreResult<Map<String, List<String>>> result = store.addObservations(
            List.of(new ObservationAddition("ghost", List.of("boo")))
        );

        assertThat(result.error().kind()).isEqualTo(ErrorKind.ENTITY_NOT_FOUND);
        assertThat(result.error().message()).contains("ghost");
        assertThat(store.readGraph().orElseThrow().entities()).isEmpty();
    }

    @Test
    void shouldDeleteEntitiesIdempotently() throws Exception {
        store.createEntities(List.of(Entity.of("alice", "person", List.of()))).orElseThrow();

        assertThat(store.deleteEntities(List.of("alice")).orElseThrow()).containsExactly("alice");
        assertThat(store.deleteEntities(List.of("alice")).orElseThrow()).isEmpty();
        assertThat(store.getEntity("alice").orElseThrow()).isEmpty();
    }

    @Test
    void shouldCascadeDeleteToRelationsOnBothEnds() throws Exception {
        store.createEntities(List.of(
            Entity.of("a", "node", List.of()),
            Entity.of("b", "node", List.of()),
            Entity.of("c", "node", List.of())
        )).orElseThrow();
        store.createRelations(List.of(
            Relation.of("a", "b", "links"),
            Relation.of("c", "a", "links"),
            Relation.of("b", "c", "links")
        )).orElseThrow();

        store.deleteEntities(List.of("a")).orElseThrow();

        List<Relation> remaining = store.readGraph().orElseThrow().relations();
        assertThat(remaining).hasSize(1);
        assertThat(remaining).noneMatch(r -> r.from().equals("a") || r.to().equals("a"));
    }

    @Test
    void shouldDeleteExactObservationsAndKeepOrder() throws Exception {
        store.createEntities(List.of(Entity.of("alice", "person", List.of("a", "b", "c", "b", "d")))).orElseThrow();

        Map<String, List<String>> removed = store.deleteObservations(
            List.of(new ObservationDeletion("alice", List.of("b", "B", "x")))
        ).orElseThrow();

        assertThat(removed).containsEntry("alice", List.of("b", "b"));
        assertThat(store.getEntity("alice").orElseThrow().orElseThrow().observations()).containsExactly("a", "c", "d");
        assertThat(store.deleteObservations(List.of(new ObservationDeletion("ghost", List.of("a")))).isOk()).isTrue();
    }

    @Test
    void shouldProcessInputsAcrossSeveralBatches() throws Exception {
        List<Entity> many = IntStream.range(0, 25)
            .mapToObj(i -> Entity.of("entity-" + i, "bulk", List.of("n" + i)))
            .toList();

        assertThat(store.createEntities(many, 4).orElseThrow()).hasSize(25);
        assertThat(store.readGraph().orElseThrow().entities()).hasSize(25);
        assertThat(store.deleteEntities(many.stream().map(Entity::name).toList(), 7).orElseThrow()).hasSize(25);
        assertThat(store.createEntities(many, 0).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void shouldLinkEntitiesToKnownCategories() throws Exception {
        Category category = store.createCategory("projects", 4, 90).orElseThrow();
        Entity linked = new Entity("mnemo", "project", List.of(), null, null, null, null, null, (int) category.id());
        Entity dangling = new Entity("other", "project", List.of(), null, null, null, null, null, 999);

        store.createEntities(List.of(linked)).orElseThrow();

        assertThat(store.getEntity("mnemo").orElseThrow().orElseThrow().categoryId()).isEqualTo((int) category.id());
        assertThat(store.createEntities(List.of(dangling)).error().kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }
}
