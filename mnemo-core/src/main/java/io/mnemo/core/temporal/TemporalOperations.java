package io.mnemo.core.temporal;

import io.mnemo.core.model.Direction;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.JsonColumns;
import io.mnemo.core.storage.Rows;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class TemporalOperations {
    private static final String ENTITY_VERSION_COLUMNS = """
        v.entity_name, v.entity_type, v.observations, v.confidence_score, v.context_source, v.metadata,
        v.category_id, v.created_at, v.version_number, v.change_type, v.valid_from, v.valid_until, v.changed_by
        """;
    private static final String RELATION_VERSION_COLUMNS = """
        v.from_entity, v.to_entity, v.relation_type, v.confidence_score, v.context_source, v.created_at,
        v.effective_from, v.effective_until, v.version_number, v.change_type, v.valid_from, v.valid_until, v.changed_by
        """;
    private static final String VERSION_CONTAINS = "v.valid_from <= ?1 AND (v.valid_until IS NULL OR ?1 < v.valid_until)";
    private static final String EFFECTIVE_CONTAINS = "v.effective_from <= ?1 AND (v.effective_until IS NULL OR ?1 < v.effective_until)";

    private static final String ENTITY_AT_TIME = "SELECT " + ENTITY_VERSION_COLUMNS
        + " FROM entity_versions v WHERE v.entity_name = ?2 AND " + VERSION_CONTAINS
        + " ORDER BY v.version_number DESC LIMIT 1";
    private static final String ENTITY_CHANGES = "SELECT " + ENTITY_VERSION_COLUMNS + """
         FROM entity_versions v
        WHERE v.entity_name = ?1
          AND (?2 IS NULL OR v.valid_from >= ?2)
          AND (?3 IS NULL OR v.valid_from <= ?3)
        ORDER BY v.valid_from ASC, v.version_number ASC
        """;
    private static final String RELATIONS_AT_TIME = "SELECT " + RELATION_VERSION_COLUMNS
        + " FROM relation_versions v WHERE " + VERSION_CONTAINS + " AND " + EFFECTIVE_CONTAINS
        + " AND v.change_type <> 'delete'"
        + " AND ((?2 = 1 AND v.from_entity = ?4) OR (?3 = 1 AND v.to_entity = ?4))"
        + " ORDER BY v.relation_type, v.from_entity, v.to_entity";
    private static final String RELATION_AT_TIME = "SELECT " + RELATION_VERSION_COLUMNS
        + " FROM relation_versions v WHERE " + VERSION_CONTAINS
        + " AND v.from_entity = ?2 AND v.to_entity = ?3 AND v.relation_type = ?4"
        + " ORDER BY v.version_number DESC LIMIT 1";
    private static final String RELATION_HISTORY = "SELECT " + RELATION_VERSION_COLUMNS + """
         FROM relation_versions v
        WHERE v.from_entity = ?1 AND v.to_entity = ?2 AND v.relation_type = ?3
          AND (?4 IS NULL OR v.valid_from >= ?4)
          AND (?5 IS NULL OR v.valid_from <= ?5)
        ORDER BY v.valid_from ASC, v.version_number ASC
        """;
    private static final String CHANGES_IN_PERIOD = "WITH live AS ("
        + Partition.unionAll("name, entity_type", null)
        + ") SELECT " + ENTITY_VERSION_COLUMNS + """
         FROM entity_versions v
        LEFT JOIN live l ON l.name = v.entity_name
        WHERE v.valid_from >= ?1 AND v.valid_from <= ?2
          AND (?3 IS NULL OR COALESCE(l.entity_type, v.entity_type) = ?3)
          AND (?4 IS NULL OR v.change_type = ?4)
        ORDER BY v.valid_from DESC, v.id DESC
        """;
    private static final String GRAPH_ENTITIES_AT_TIME = "SELECT " + ENTITY_VERSION_COLUMNS
        + " FROM entity_versions v WHERE " + VERSION_CONTAINS + " AND v.change_type <> 'delete'"
        + " ORDER BY v.entity_name";
    private static final String GRAPH_RELATIONS_AT_TIME = "SELECT " + RELATION_VERSION_COLUMNS
        + " FROM relation_versions v WHERE " + VERSION_CONTAINS + " AND " + EFFECTIVE_CONTAINS
        + " AND v.change_type <> 'delete' ORDER BY v.from_entity, v.to_entity, v.relation_type";

    private final StorageContext context;
    private final JsonColumns json;

    public TemporalOperations(StorageContext context) {
        this.context = context;
        this.json = context.json();
    }

    public StoreResult<Optional<EntityVersion>> getEntityAtTime(String name, Instant t) {
        String entityName = Sanitizer.identity(name);
        if (entityName.isEmpty() || t == null) {
            return StoreResult.failure(StoreError.invalidArgument("entity name and timestamp are required"));
        }
        return context.read("get_entity_at_time", handle -> {
            PreparedStatement statement = handle.prepare(ENTITY_AT_TIME);
            statement.setLong(1, t.toEpochMilli());
            statement.setString(2, entityName);
            List<EntityVersion> versions = entityVersions(statement);
            Optional<EntityVersion> found = versions.stream()
                .filter(version -> version.changeType() != ChangeType.DELETE)
                .findFirst();
            return StoreResult.ok(found);
        });
    }

    public StoreResult<List<EntityVersion>> getEntityChanges(String name, Instant start, Instant end) {
        String entityName = Sanitizer.identity(name);
        if (entityName.isEmpty()) {
            return StoreResult.failure(StoreError.invalidArgument("entity name is required"));
        }
        if (start != null && end != null && start.isAfter(end)) {
            return StoreResult.failure(StoreError.invalidArgument("start must not be after end"));
        }
        return context.read("get_entity_changes", handle -> {
            PreparedStatement statement = handle.prepare(ENTITY_CHANGES);
            statement.setString(1, entityName);
            Rows.setInstant(statement, 2, start);
            Rows.setInstant(statement, 3, end);
            return StoreResult.ok(entityVersions(statement));
        });
    }

    public StoreResult<List<RelationVersion>> getRelationsAtTime(String name, Instant t, Direction direction) {
        String entityName = Sanitizer.identity(name);
        if (entityName.isEmpty() || t == null) {
            return StoreResult.failure(StoreError.invalidArgument("entity name and timestamp are required"));
        }
        Direction safe = direction == null ? Direction.BOTH : direction;
        return context.read("get_relations_at_time", handle -> {
            PreparedStatement statement = handle.prepare(RELATIONS_AT_TIME);
            statement.setLong(1, t.toEpochMilli());
            statement.setInt(2, safe.includesOutgoing() ? 1 : 0);
            statement.setInt(3, safe.includesIncoming() ? 1 : 0);
            statement.setString(4, entityName);
            return StoreResult.ok(relationVersions(statement));
        });
    }

    public StoreResult<Optional<RelationVersion>> getRelationAtTime(String from, String to, String relationType, Instant t) {
        String source = Sanitizer.identity(from);
        String target = Sanitizer.identity(to);
        String type = Sanitizer.identity(relationType);
        if (source.isEmpty() || target.isEmpty() || type.isEmpty() || t == null) {
            return StoreResult.failure(StoreError.invalidArgument("from, to, relationType and timestamp are required"));
        }
        return context.read("get_relation_at_time", handle -> {
            PreparedStatement statement = handle.prepare(RELATION_AT_TIME);
            statement.setLong(1, t.toEpochMilli());
            statement.setString(2, source);
            statement.setString(3, target);
            statement.setString(4, type);
            Optional<RelationVersion> found = relationVersions(statement).stream()
                .filter(version -> version.changeType() != ChangeType.DELETE)
                .filter(version -> effectiveAt(version, t))
                .findFirst();
            return StoreResult.ok(found);
        });
    }

    public StoreResult<List<RelationVersion>> getRelationHistory(String from, String to, String relationType, Instant start, Instant end) {
        String source = Sanitizer.identity(from);
        String target = Sanitizer.identity(to);
        String type = Sanitizer.identity(relationType);
        if (source.isEmpty() || target.isEmpty() || type.isEmpty()) {
            return StoreResult.failure(StoreError.invalidArgument("from, to and relationType are required"));
        }
        return context.read("get_relation_history", handle -> {
            PreparedStatement statement = handle.prepare(RELATION_HISTORY);
            statement.setString(1, source);
            statement.setString(2, target);
            statement.setString(3, type);
            Rows.setInstant(statement, 4, start);
            Rows.setInstant(statement, 5, end);
            return StoreResult.ok(relationVersions(statement));
        });
    }

    public StoreResult<List<EntityVersion>> getChangesInPeriod(Instant start, Instant end, String entityType, ChangeType changeType) {
        if (start == null || end == null) {
            return StoreResult.failure(StoreError.invalidArgument("start and end are required"));
        }
        if (start.isAfter(end)) {
            return StoreResult.failure(StoreError.invalidArgument("start must not be after end"));
        }
        String type = entityType == null || entityType.isBlank() ? null : Sanitizer.identity(entityType);
        return context.read("get_changes_in_period", handle -> {
            PreparedStatement statement = handle.prepare(CHANGES_IN_PERIOD);
            statement.setLong(1, start.toEpochMilli());
            statement.setLong(2, end.toEpochMilli());
            Rows.setNullableString(statement, 3, type);
            Rows.setNullableString(statement, 4, changeType == null ? null : changeType.wireName());
            return StoreResult.ok(entityVersions(statement));
        });
    }

    public StoreResult<KnowledgeGraph> getGraphAtTime(Instant t) {
        if (t == null) {
            return StoreResult.failure(StoreError.invalidArgument("timestamp is required"));
        }
        return context.read("get_graph_at_time", handle -> {
            PreparedStatement entities = handle.prepare(GRAPH_ENTITIES_AT_TIME);
            entities.setLong(1, t.toEpochMilli());
            List<EntityVersion> entityVersions = entityVersions(entities);
            PreparedStatement relations = handle.prepare(GRAPH_RELATIONS_AT_TIME);
            relations.setLong(1, t.toEpochMilli());
            List<RelationVersion> relationVersions = relationVersions(relations);
            return StoreResult.ok(new KnowledgeGraph(
                entityVersions.stream().map(EntityVersion::toEntity).toList(),
                relationVersions.stream().map(RelationVersion::toRelation).toList()
            ));
        });
    }

    private boolean effectiveAt(RelationVersion version, Instant t) {
        return !version.effectiveFrom().isAfter(t)
            && (version.effectiveUntil() == null || t.isBefore(version.effectiveUntil()));
    }

    private List<EntityVersion> entityVersions(PreparedStatement statement) throws SQLException {
        List<EntityVersion> versions = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                versions.add(new EntityVersion(
                    resultSet.getString("entity_name"),
                    resultSet.getString("entity_type"),
                    json.readList(resultSet.getString("observations")),
                    resultSet.getDouble("confidence_score"),
                    resultSet.getString("context_source"),
                    json.readMap(resultSet.getString("metadata")),
                    Rows.nullableInt(resultSet, "category_id"),
                    Rows.instant(resultSet, "created_at"),
                    resultSet.getInt("version_number"),
                    changeType(resultSet.getString("change_type")),
                    Rows.instant(resultSet, "valid_from"),
                    Rows.instant(resultSet, "valid_until"),
                    resultSet.getString("changed_by")
                ));
            }
        }
        return versions;
    }

    private List<RelationVersion> relationVersions(PreparedStatement statement) throws SQLException {
        List<RelationVersion> versions = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                versions.add(new RelationVersion(
                    resultSet.getString("from_entity"),
                    resultSet.getString("to_entity"),
                    resultSet.getString("relation_type"),
                    resultSet.getDouble("confidence_score"),
                    resultSet.getString("context_source"),
                    Rows.instant(resultSet, "created_at"),
                    Rows.instant(resultSet, "effective_from"),
                    Rows.instant(resultSet, "effective_until"),
                    resultSet.getInt("version_number"),
                    changeType(resultSet.getString("change_type")),
                    Rows.instant(resultSet, "valid_from"),
                    Rows.instant(resultSet, "valid_until"),
                    resultSet.getString("changed_by")
                ));
            }
        }
        return versions;
    }

    private ChangeType changeType(String raw) throws SQLException {
        return ChangeType.parse(raw).orElseThrow(() -> new SQLException("Unknown change type: " + raw));
    }
}
