package io.mnemo.mcp.server;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public enum GraphOperation {
    CREATE_ENTITIES("create_entities", "graph", true,
        "Create entities; fails as a whole if any name already exists",
        schema(List.of("entities"), "entities", "array", "batchSize", "integer")),
    ADD_OBSERVATIONS("add_observations", "graph", true,
        "Append observations to existing entities",
        schema(List.of("observations"), "observations", "array", "batchSize", "integer")),
    DELETE_ENTITIES("delete_entities", "graph", true,
        "Delete entities and every relation touching them",
        schema(List.of("entityNames"), "entityNames", "array", "batchSize", "integer")),
    DELETE_OBSERVATIONS("delete_observations", "graph", true,
        "Remove specific observations from entities",
        schema(List.of("deletions"), "deletions", "array", "batchSize", "integer")),
    CREATE_RELATIONS("create_relations", "graph", true,
        "Create relations between existing entities; duplicates are skipped",
        schema(List.of("relations"), "relations", "array", "batchSize", "integer")),
    DELETE_RELATIONS("delete_relations", "graph", true,
        "Delete relations by (from, to, relationType)",
        schema(List.of("relations"), "relations", "array", "batchSize", "integer")),
    SEARCH_NODES("search_nodes", "graph", false,
        "Case-insensitive substring search over names, types and observations",
        schema(List.of("query"), "query", "string")),
    OPEN_NODES("open_nodes", "graph", false,
        "Fetch entities by name with the relations among them",
        schema(List.of("names"), "names", "array")),
    READ_GRAPH("read_graph", "graph", false,
        "Dump every live entity and relation",
        schema(List.of())),
    GET_ENTITY("get_entity", "graph", false,
        "Fetch one live entity by name",
        schema(List.of("name"), "name", "string")),
    GET_ENTITY_AT_TIME("get_entity_at_time", "temporal", false,
        "Entity state as of a timestamp",
        schema(List.of("name", "timestamp"), "name", "string", "timestamp", "string")),
    GET_ENTITY_CHANGES("get_entity_changes", "temporal", false,
        "Versions of an entity, oldest first, optionally bounded by start and end",
        schema(List.of("name"), "name", "string", "start", "string", "end", "string")),
    GET_RELATIONS_AT_TIME("get_relations_at_time", "temporal", false,
        "Relations touching an entity as of a timestamp",
        schema(List.of("name", "timestamp"), "name", "string", "timestamp", "string", "direction", "string")),
    GET_RELATION_AT_TIME("get_relation_at_time", "temporal", false,
        "One relation as of a timestamp",
        schema(List.of("from", "to", "relationType", "timestamp"),
            "from", "string", "to", "string", "relationType", "string", "timestamp", "string")),
    GET_RELATION_HISTORY("get_relation_history", "temporal", false,
        "Versions of one relation, oldest first",
        schema(List.of("from", "to", "relationType"),
            "from", "string", "to", "string", "relationType", "string", "start", "string", "end", "string")),
    GET_CHANGES_IN_PERIOD("get_changes_in_period", "temporal", false,
        "Entity versions created in a window, newest first",
        schema(List.of("start", "end"),
            "start", "string", "end", "string", "entityType", "string", "changeType", "string")),
    GET_GRAPH_AT_TIME("get_graph_at_time", "temporal", false,
        "Entities and relations as of a timestamp",
        schema(List.of("timestamp"), "timestamp", "string")),
    CREATE_CATEGORY("create_category", "category", true,
        "Create a knowledge category",
        schema(List.of("name", "priority"), "name", "string", "priority", "integer", "retentionDays", "integer")),
    LIST_CATEGORIES("list_categories", "category", false,
        "List knowledge categories",
        schema(List.of())),
    PARTITION_OF("partition_of", "partition", false,
        "Partition currently holding an entity",
        schema(List.of("name"), "name", "string")),
    PARTITION_COUNTS("partition_counts", "partition", false,
        "Entity rows per partition",
        schema(List.of())),
    ENTITY_STATISTICS("entity_statistics", "partition", false,
        "Per-type entity statistics from the last maintenance pass",
        schema(List.of())),
    RELATION_SUMMARY("relation_summary", "partition", false,
        "Per-type relation summary from the last maintenance pass",
        schema(List.of())),
    RUN_MAINTENANCE("run_maintenance", "partition", true,
        "Run one partition maintenance pass now",
        schema(List.of()));

    private final String wireName;
    private final String group;
    private final boolean mutating;
    private final String description;
    private final Map<String, Object> inputSchema;

    GraphOperation(String wireName, String group, boolean mutating, String description, Map<String, Object> inputSchema) {
        this.wireName = wireName;
        this.group = group;
        this.mutating = mutating;
        this.description = description;
        this.inputSchema = inputSchema;
    }

    public String wireName() {
        return wireName;
    }

    public String group() {
        return group;
    }

    public boolean mutating() {
        return mutating;
    }

    public String description() {
        return description;
    }

    public Map<String, Object> inputSchema() {
        return inputSchema;
    }

    public static Optional<GraphOperation> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (GraphOperation operation : values()) {
            if (operation.wireName.equals(name.trim())) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }

    private static Map<String, Object> schema(List<String> required, String... namesAndTypes) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndTypes.length; i += 2) {
            properties.put(namesAndTypes[i], Map.of("type", namesAndTypes[i + 1]));
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }
}
