package io.mnemo.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.temporal.EntityVersion;
import io.mnemo.mcp.server.model.ToolCallResponse;
import io.mnemo.mcp.server.model.ToolDefinition;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolRouterTest {
    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private KnowledgeGraphStore store;
    private ToolRouter router;

    @BeforeEach
    void setUp() throws Exception {
        MnemoConfig config = MnemoConfig.defaults().withStorage(
            StorageConfig.defaults().withDatabaseUrl("sqlite://" + tempDir.resolve("memory.db"))
        );
        store = KnowledgeGraphStore.open(config, Clock.fixed(NOW, ZoneOffset.UTC));
        router = new ToolRouter(store, McpServerApplication.createMapper());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void listsEveryOperationOnce() {
        List<ToolDefinition> tools = router.listTools();

        assertThat(tools).extracting(ToolDefinition::name)
            .containsExactlyInAnyOrderElementsOf(Arrays.stream(GraphOperation.values()).map(GraphOperation::wireName).toList())
            .isSorted();
        assertThat(tools).filteredOn(ToolDefinition::mutating).extracting(ToolDefinition::name)
            .contains("create_entities", "delete_relations", "run_maintenance")
            .doesNotContain("search_nodes");
    }

    @Test
    @SuppressWarnings("unchecked")
    void routesCreateAndSearch() {
        ToolCallResponse created = router.callTool("create_entities", Map.of(
            "entities", List.of(
                Map.of("name", "alice", "entityType", "person", "observations", List.of("likes tea")),
                Map.of("name", "bob", "entityType", "person")
            )
        ));
        ToolCallResponse related = router.callTool("create_relations", Map.of(
            "relations", List.of(Map.of("from", "alice", "to", "bob", "relationType", "knows"))
        ));
        ToolCallResponse searched = router.callTool("search_nodes", Map.of("query", "TEA"));

        assertThat(created.ok()).isTrue();
        assertThat((List<Entity>) created.data().get("result")).extracting(Entity::name).containsExactly("alice", "bob");
        assertThat(related.ok()).isTrue();
        KnowledgeGraph graph = (KnowledgeGraph) searched.data().get("result");
        assertThat(graph.entities()).extracting(Entity::name).containsExactly("alice");
        assertThat(graph.relations()).hasSize(1);
    }

    @Test
    void mapsStoreFailuresToErrorKind() {
        ToolCallResponse response = router.callTool("add_observations", Map.of(
            "observations", List.of(Map.of("entityName", "ghost", "contents", List.of("boo")))
        ));

        assertThat(response.ok()).isFalse();
        assertThat(response.data()).containsEntry("errorKind", "entity_not_found");
        assertThat(response.message()).contains("ghost");
    }

    @Test
    void rejectsMalformedArguments() {
        ToolCallResponse badTimestamp = router.callTool("get_entity_at_time", Map.of("name", "alice", "timestamp", "yesterday"));
        ToolCallResponse badDirection = router.callTool("get_relations_at_time", Map.of(
            "name", "alice", "timestamp", NOW.toString(), "direction", "sideways"
        ));
        ToolCallResponse badChangeType = router.callTool("get_changes_in_period", Map.of(
            "start", NOW.toString(), "end", NOW.toString(), "changeType", "rename"
        ));

        assertThat(badTimestamp.data()).containsEntry("errorKind", "invalid_argument");
        assertThat(badDirection.data()).containsEntry("errorKind", "invalid_argument");
        assertThat(badChangeType.data()).containsEntry("errorKind", "invalid_argument");
    }

    @Test
    void unwrapsOptionalResults() {
        router.callTool("create_entities", Map.of("entities", List.of(Map.of("name", "alice", "entityType", "person"))));

        ToolCallResponse found = router.callTool("get_entity_at_time", Map.of("name", "alice", "timestamp", NOW.toString()));
        ToolCallResponse missing = router.callTool("get_entity", Map.of("name", "nobody"));
        ToolCallResponse partition = router.callTool("partition_of", Map.of("name", "alice"));

        assertThat(found.data().get("result")).isInstanceOf(EntityVersion.class);
        assertThat(missing.ok()).isTrue();
        assertThat(missing.data()).containsEntry("result", null);
        assertThat(partition.data()).containsEntry("result", "recent");
    }

    @Test
    void returnsErrorForUnknownTool() {
        ToolCallResponse response = router.callTool("drop_database", Map.of());

        assertThat(response.ok()).isFalse();
        assertThat(response.message()).contains("Unknown tool");
    }
}
