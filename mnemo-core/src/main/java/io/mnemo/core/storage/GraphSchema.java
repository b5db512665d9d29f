package io.mnemo.core.storage;

import io.mnemo.core.partition.Partition;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GraphSchema {
    private static final Logger LOG = LoggerFactory.getLogger(GraphSchema.class);

    private static final String ENTITY_TABLE = """
        CREATE TABLE IF NOT EXISTS %1$s (
            name TEXT PRIMARY KEY,
            entity_type TEXT NOT NULL,
            observations TEXT NOT NULL DEFAULT '[]',
            confidence_score REAL NOT NULL DEFAULT 1.0,
            context_source TEXT,
            metadata TEXT NOT NULL DEFAULT '{}',
            created_at INTEGER NOT NULL,
            last_updated INTEGER NOT NULL,
            category_id INTEGER
        )
        """;

    private static final String ENTITY_INDEXES = """
        CREATE INDEX IF NOT EXISTS idx_%1$s_type ON %1$s(entity_type);
        CREATE INDEX IF NOT EXISTS idx_%1$s_created_at ON %1$s(created_at)
        """;

    private static final String RELATIONS = """
        CREATE TABLE IF NOT EXISTS relations (
            from_entity TEXT NOT NULL,
            to_entity TEXT NOT NULL,
            relation_type TEXT NOT NULL,
            confidence_score REAL NOT NULL DEFAULT 1.0,
            context_source TEXT,
            created_at INTEGER NOT NULL,
            valid_from INTEGER NOT NULL,
            valid_until INTEGER,
            PRIMARY KEY (from_entity, to_entity, relation_type)
        )
        """;

    private static final String ENTITY_VERSIONS = """
        CREATE TABLE IF NOT EXISTS entity_versions (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            entity_name TEXT NOT NULL,
            entity_type TEXT NOT NULL,
            observations TEXT NOT NULL,
            confidence_score REAL NOT NULL,
            context_source TEXT,
            metadata TEXT NOT NULL,
            category_id INTEGER,
            created_at INTEGER NOT NULL,
            version_number INTEGER NOT NULL,
            change_type TEXT NOT NULL CHECK (change_type IN ('create', 'update', 'delete')),
            valid_from INTEGER NOT NULL,
            valid_until INTEGER,
            changed_by TEXT,
            UNIQUE (entity_name, version_number)
        )
        """;

    private static final String RELATION_VERSIONS = """
        CREATE TABLE IF NOT EXISTS relation_versions (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            from_entity TEXT NOT NULL,
            to_entity TEXT NOT NULL,
            relation_type TEXT NOT NULL,
            confidence_score REAL NOT NULL,
            context_source TEXT,
            created_at INTEGER NOT NULL,
            effective_from INTEGER NOT NULL,
            effective_until INTEGER,
            version_number INTEGER NOT NULL,
            change_type TEXT NOT NULL CHECK (change_type IN ('create', 'update', 'delete')),
            valid_from INTEGER NOT NULL,
            valid_until INTEGER,
            changed_by TEXT,
            UNIQUE (from_entity, to_entity, relation_type, version_number)
        )
        """;

    private static final String SUMMARIES = """
        CREATE TABLE IF NOT EXISTS mv_entity_stats (
            entity_type TEXT PRIMARY KEY,
            entity_count INTEGER NOT NULL,
            avg_confidence REAL,
            oldest_created_at INTEGER,
            newest_created_at INTEGER,
            refreshed_at INTEGER NOT NULL
        );
        CREATE TABLE IF NOT EXISTS mv_relation_summary (
            relation_type TEXT PRIMARY KEY,
            relation_count INTEGER NOT NULL,
            distinct_sources INTEGER NOT NULL,
            distinct_targets INTEGER NOT NULL,
            avg_confidence REAL,
            refreshed_at INTEGER NOT NULL
        );
        CREATE TABLE IF NOT EXISTS knowledge_categories (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL UNIQUE,
            priority INTEGER NOT NULL DEFAULT 3 CHECK (priority BETWEEN 1 AND 5),
            retention_days INTEGER,
            created_at INTEGER NOT NULL
        )
        """;

    private static final String INDEXES = """
        CREATE INDEX IF NOT EXISTS idx_relations_to ON relations(to_entity);
        CREATE INDEX IF NOT EXISTS idx_relations_type ON relations(relation_type);
        CREATE INDEX IF NOT EXISTS idx_entity_versions_name ON entity_versions(entity_name, valid_from);
        CREATE INDEX IF NOT EXISTS idx_entity_versions_valid_from ON entity_versions(valid_from);
        CREATE INDEX IF NOT EXISTS idx_relation_versions_key ON relation_versions(from_entity, to_entity, relation_type, valid_from);
        CREATE INDEX IF NOT EXISTS idx_relation_versions_to ON relation_versions(to_entity, valid_from)
        """;

    private GraphSchema() {
    }

    public static List<String> statements() {
        List<String> statements = new ArrayList<>();
        for (Partition partition : Partition.values()) {
            statements.add(ENTITY_TABLE.formatted(partition.tableName()));
            statements.addAll(split(ENTITY_INDEXES.formatted(partition.tableName())));
        }
        statements.add(RELATIONS);
        statements.add(ENTITY_VERSIONS);
        statements.add(RELATION_VERSIONS);
        statements.addAll(split(SUMMARIES));
        statements.addAll(split(INDEXES));
        return statements;
    }

    public static void apply(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : statements()) {
                statement.execute(ddl);
            }
        }
        LOG.debug("Graph schema ensured");
    }

    private static List<String> split(String script) {
        List<String> parts = new ArrayList<>();
        for (String part : script.split(";")) {
            if (!part.isBlank()) {
                parts.add(part.strip());
            }
        }
        return parts;
    }
}
