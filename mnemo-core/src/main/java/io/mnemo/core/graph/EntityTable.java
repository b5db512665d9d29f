package io.mnemo.core.graph;

import io.mnemo.core.model.Entity;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.storage.JsonColumns;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.Rows;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class EntityTable {
    public static final String COLUMNS = """
        name, entity_type, observations, confidence_score, context_source, metadata, created_at, last_updated, category_id""";

    private static final String FIND_BY_NAME = "SELECT * FROM ("
        + unionWithSource("name = ?1") + ")";
    private static final String FIND_BY_NAMES = "SELECT * FROM ("
        + unionWithSource("name IN (SELECT value FROM json_each(?1))") + ") ORDER BY created_at DESC, name";
    private static final String READ_ALL = "SELECT * FROM ("
        + unionWithSource(null) + ") ORDER BY created_at DESC, name";

    private static final Map<Partition, String> INSERTS = new EnumMap<>(Partition.class);
    private static final Map<Partition, String> UPDATES = new EnumMap<>(Partition.class);
    private static final Map<Partition, String> DELETES = new EnumMap<>(Partition.class);

    static {
        for (Partition partition : Partition.values()) {
            INSERTS.put(partition, "INSERT INTO " + partition.tableName() + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)");
            UPDATES.put(partition, "UPDATE " + partition.tableName() + " SET observations = ?, last_updated = ? WHERE name = ?");
            DELETES.put(partition, "DELETE FROM " + partition.tableName() + " WHERE name = ?");
        }
    }

    private final JsonColumns json;

    public EntityTable(JsonColumns json) {
        this.json = json;
    }

    public Optional<LocatedEntity> find(PooledConnection handle, String name) throws SQLException {
        PreparedStatement statement = handle.prepare(FIND_BY_NAME);
        statement.setString(1, name);
        List<LocatedEntity> found = located(statement);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<LocatedEntity> findAll(PooledConnection handle, Collection<String> names) throws SQLException {
        if (names.isEmpty()) {
            return List.of();
        }
        PreparedStatement statement = handle.prepare(FIND_BY_NAMES);
        statement.setString(1, json.writeList(List.copyOf(names)));
        return located(statement);
    }

    public List<Entity> readAll(PooledConnection handle) throws SQLException {
        return located(handle.prepare(READ_ALL)).stream().map(LocatedEntity::entity).toList();
    }

    public void insert(PooledConnection handle, Partition partition, Entity entity) throws SQLException {
        PreparedStatement statement = handle.prepare(INSERTS.get(partition));
        statement.setString(1, entity.name());
        statement.setString(2, entity.entityType());
        statement.setString(3, json.writeList(entity.observations()));
        statement.setDouble(4, entity.confidenceScore());
        Rows.setNullableString(statement, 5, entity.contextSource());
        statement.setString(6, json.writeMap(entity.metadata()));
        Rows.setInstant(statement, 7, entity.createdAt());
        Rows.setInstant(statement, 8, entity.lastUpdated());
        Rows.setNullableInt(statement, 9, entity.categoryId());
        statement.executeUpdate();
    }

    public void updateObservations(PooledConnection handle, LocatedEntity located, Entity updated) throws SQLException {
        PreparedStatement statement = handle.prepare(UPDATES.get(located.partition()));
        statement.setString(1, json.writeList(updated.observations()));
        Rows.setInstant(statement, 2, updated.lastUpdated());
        statement.setString(3, updated.name());
        statement.executeUpdate();
    }

    public boolean delete(PooledConnection handle, LocatedEntity located) throws SQLException {
        PreparedStatement statement = handle.prepare(DELETES.get(located.partition()));
        statement.setString(1, located.entity().name());
        return statement.executeUpdate() > 0;
    }

    public Entity map(ResultSet resultSet) throws SQLException {
        return new Entity(
            resultSet.getString("name"),
            resultSet.getString("entity_type"),
            json.readList(resultSet.getString("observations")),
            resultSet.getDouble("confidence_score"),
            resultSet.getString("context_source"),
            json.readMap(resultSet.getString("metadata")),
            Rows.instant(resultSet, "created_at"),
            Rows.instant(resultSet, "last_updated"),
            Rows.nullableInt(resultSet, "category_id")
        );
    }

    private List<LocatedEntity> located(PreparedStatement statement) throws SQLException {
        List<LocatedEntity> entities = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                Partition partition = Partition.fromTable(resultSet.getString("source_table"))
                    .orElseThrow(() -> new SQLException("Unknown partition table"));
                entities.add(new LocatedEntity(map(resultSet), partition));
            }
        }
        return entities;
    }

    private static String unionWithSource(String where) {
        StringBuilder sql = new StringBuilder();
        for (Partition partition : Partition.values()) {
            if (sql.length() > 0) {
                sql.append(" UNION ALL ");
            }
            sql.append("SELECT ").append(COLUMNS)
                .append(", '").append(partition.tableName()).append("' AS source_table FROM ")
                .append(partition.tableName());
            if (where != null) {
                sql.append(" WHERE ").append(where);
            }
        }
        return sql.toString();
    }
}
