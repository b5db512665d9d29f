package io.mnemo.core.graph;

import io.mnemo.core.model.Relation;
import io.mnemo.core.model.RelationKey;
import io.mnemo.core.storage.JsonColumns;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.Rows;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class RelationTable {
    private static final String COLUMNS =
        "from_entity, to_entity, relation_type, confidence_score, context_source, created_at, valid_from, valid_until";

    private static final String INSERT = "INSERT INTO relations (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)"
        + " ON CONFLICT (from_entity, to_entity, relation_type) DO NOTHING";
    private static final String FIND = "SELECT " + COLUMNS
        + " FROM relations WHERE from_entity = ? AND to_entity = ? AND relation_type = ?";
    private static final String DELETE = "DELETE FROM relations WHERE from_entity = ? AND to_entity = ? AND relation_type = ?";
    private static final String AMONG = "SELECT " + COLUMNS + """
         FROM relations
        WHERE from_entity IN (SELECT value FROM json_each(?1))
          AND to_entity IN (SELECT value FROM json_each(?1))
        ORDER BY from_entity, to_entity, relation_type
        """;
    private static final String TOUCHING = "SELECT " + COLUMNS + """
         FROM relations
        WHERE from_entity IN (SELECT value FROM json_each(?1))
           OR to_entity IN (SELECT value FROM json_each(?1))
        ORDER BY from_entity, to_entity, relation_type
        """;
    private static final String READ_ALL = "SELECT " + COLUMNS + " FROM relations ORDER BY from_entity, to_entity, relation_type";

    private final JsonColumns json;

    public RelationTable(JsonColumns json) {
        this.json = json;
    }

    public boolean insertIfAbsent(PooledConnection handle, Relation relation) throws SQLException {
        PreparedStatement statement = handle.prepare(INSERT);
        statement.setString(1, relation.from());
        statement.setString(2, relation.to());
        statement.setString(3, relation.relationType());
        statement.setDouble(4, relation.confidenceScore());
        Rows.setNullableString(statement, 5, relation.contextSource());
        Rows.setInstant(statement, 6, relation.createdAt());
        Rows.setInstant(statement, 7, relation.validFrom());
        Rows.setInstant(statement, 8, relation.validUntil());
        return statement.executeUpdate() > 0;
    }

    public Optional<Relation> find(PooledConnection handle, RelationKey key) throws SQLException {
        PreparedStatement statement = handle.prepare(FIND);
        statement.setString(1, key.from());
        statement.setString(2, key.to());
        statement.setString(3, key.relationType());
        List<Relation> found = relations(statement);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public boolean delete(PooledConnection handle, RelationKey key) throws SQLException {
        PreparedStatement statement = handle.prepare(DELETE);
        statement.setString(1, key.from());
        statement.setString(2, key.to());
        statement.setString(3, key.relationType());
        return statement.executeUpdate() > 0;
    }

    public List<Relation> among(PooledConnection handle, Collection<String> names) throws SQLException {
        if (names.isEmpty()) {
            return List.of();
        }
        PreparedStatement statement = handle.prepare(AMONG);
        statement.setString(1, json.writeList(List.copyOf(names)));
        return relations(statement);
    }

    public List<Relation> touching(PooledConnection handle, Collection<String> names) throws SQLException {
        if (names.isEmpty()) {
            return List.of();
        }
        PreparedStatement statement = handle.prepare(TOUCHING);
        statement.setString(1, json.writeList(List.copyOf(names)));
        return relations(statement);
    }

    public List<Relation> readAll(PooledConnection handle) throws SQLException {
        return relations(handle.prepare(READ_ALL));
    }

    private List<Relation> relations(PreparedStatement statement) throws SQLException {
        List<Relation> relations = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                relations.add(new Relation(
                    resultSet.getString("from_entity"),
                    resultSet.getString("to_entity"),
                    resultSet.getString("relation_type"),
                    resultSet.getDouble("confidence_score"),
                    resultSet.getString("context_source"),
                    Rows.instant(resultSet, "created_at"),
                    Rows.instant(resultSet, "valid_from"),
                    Rows.instant(resultSet, "valid_until")
                ));
            }
        }
        return relations;
    }
}
