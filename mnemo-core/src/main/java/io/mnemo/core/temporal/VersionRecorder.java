package io.mnemo.core.temporal;

import io.mnemo.core.model.Entity;
import io.mnemo.core.model.Relation;
import io.mnemo.core.storage.JsonColumns;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.Rows;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Appends version records for every mutation of the live tables. Must be called on a handle
 * that is inside the mutating transaction: the open version of the identity is closed at
 * {@code now} and the new version, numbered one past the highest so far, is opened.
 */
public final class VersionRecorder {
    private static final String NEXT_ENTITY_VERSION = """
        SELECT COALESCE(MAX(version_number), 0) + 1 FROM entity_versions WHERE entity_name = ?
        """;
    private static final String CLOSE_ENTITY_VERSION = """
        UPDATE entity_versions SET valid_until = ? WHERE entity_name = ? AND valid_until IS NULL
        """;
    private static final String INSERT_ENTITY_VERSION = """
        INSERT INTO entity_versions (
            entity_name, entity_type, observations, confidence_score, context_source, metadata,
            category_id, created_at, version_number, change_type, valid_from, valid_until, changed_by
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NULL, ?)
        """;
    private static final String NEXT_RELATION_VERSION = """
        SELECT COALESCE(MAX(version_number), 0) + 1 FROM relation_versions
        WHERE from_entity = ? AND to_entity = ? AND relation_type = ?
        """;
    private static final String CLOSE_RELATION_VERSION = """
        UPDATE relation_versions SET valid_until = ?
        WHERE from_entity = ? AND to_entity = ? AND relation_type = ? AND valid_until IS NULL
        """;
    private static final String INSERT_RELATION_VERSION = """
        INSERT INTO relation_versions (
            from_entity, to_entity, relation_type, confidence_score, context_source, created_at,
            effective_from, effective_until, version_number, change_type, valid_from, valid_until, changed_by
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NULL, ?)
        """;

    private final JsonColumns json;
    private final String changedBy;

    public VersionRecorder(JsonColumns json, String changedBy) {
        this.json = json;
        this.changedBy = changedBy;
    }

    public int recordEntity(PooledConnection handle, Entity state, ChangeType change, Instant now) throws SQLException {
        requireTransaction(handle);
        int version = nextVersion(handle.prepare(NEXT_ENTITY_VERSION), state.name());

        PreparedStatement close = handle.prepare(CLOSE_ENTITY_VERSION);
        close.setLong(1, now.toEpochMilli());
        close.setString(2, state.name());
        close.executeUpdate();

        PreparedStatement insert = handle.prepare(INSERT_ENTITY_VERSION);
        insert.setString(1, state.name());
        insert.setString(2, state.entityType());
        insert.setString(3, json.writeList(state.observations()));
        insert.setDouble(4, state.confidenceScore());
        Rows.setNullableString(insert, 5, state.contextSource());
        insert.setString(6, json.writeMap(state.metadata()));
        Rows.setNullableInt(insert, 7, state.categoryId());
        Rows.setInstant(insert, 8, state.createdAt() == null ? now : state.createdAt());
        insert.setInt(9, version);
        insert.setString(10, change.wireName());
        insert.setLong(11, now.toEpochMilli());
        Rows.setNullableString(insert, 12, changedBy);
        insert.executeUpdate();
        return version;
    }

    public int recordRelation(PooledConnection handle, Relation state, ChangeType change, Instant now) throws SQLException {
        requireTransaction(handle);
        PreparedStatement next = handle.prepare(NEXT_RELATION_VERSION);
        next.setString(1, state.from());
        next.setString(2, state.to());
        next.setString(3, state.relationType());
        int version;
        try (ResultSet resultSet = next.executeQuery()) {
            resultSet.next();
            version = resultSet.getInt(1);
        }

        PreparedStatement close = handle.prepare(CLOSE_RELATION_VERSION);
        close.setLong(1, now.toEpochMilli());
        close.setString(2, state.from());
        close.setString(3, state.to());
        close.setString(4, state.relationType());
        close.executeUpdate();

        PreparedStatement insert = handle.prepare(INSERT_RELATION_VERSION);
        insert.setString(1, state.from());
        insert.setString(2, state.to());
        insert.setString(3, state.relationType());
        insert.setDouble(4, state.confidenceScore());
        Rows.setNullableString(insert, 5, state.contextSource());
        Rows.setInstant(insert, 6, state.createdAt() == null ? now : state.createdAt());
        Rows.setInstant(insert, 7, state.validFrom() == null ? now : state.validFrom());
        Rows.setInstant(insert, 8, state.validUntil());
        insert.setInt(9, version);
        insert.setString(10, change.wireName());
        insert.setLong(11, now.toEpochMilli());
        Rows.setNullableString(insert, 12, changedBy);
        insert.executeUpdate();
        return version;
    }

    private int nextVersion(PreparedStatement statement, String name) throws SQLException {
        statement.setString(1, name);
        try (ResultSet resultSet = statement.executeQuery()) {
            resultSet.next();
            return resultSet.getInt(1);
        }
    }

    private void requireTransaction(PooledConnection handle) {
        if (!handle.inTransaction()) {
            throw new IllegalStateException("Version records must be written inside a transaction");
        }
    }
}
