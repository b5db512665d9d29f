package io.mnemo.core.partition;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

public enum Partition {
    RECENT("entities_recent"),
    INTERMEDIATE("entities_intermediate"),
    ARCHIVE("entities_archive");

    private final String tableName;

    Partition(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Partition forAge(Instant createdAt, Instant now, int recentDays, int archiveAfterDays) {
        Duration age = Duration.between(createdAt, now);
        if (age.compareTo(Duration.ofDays(archiveAfterDays)) >= 0) {
            return ARCHIVE;
        }
        if (age.compareTo(Duration.ofDays(recentDays)) >= 0) {
            return INTERMEDIATE;
        }
        return RECENT;
    }

    public static String unionAll(String columns, String where) {
        StringBuilder sql = new StringBuilder();
        for (Partition partition : values()) {
            if (sql.length() > 0) {
                sql.append("\nUNION ALL\n");
            }
            sql.append("SELECT ").append(columns).append(" FROM ").append(partition.tableName);
            if (where != null && !where.isBlank()) {
                sql.append(" WHERE ").append(where);
            }
        }
        return sql.toString();
    }

    public static Optional<Partition> fromTable(String table) {
        for (Partition partition : values()) {
            if (partition.tableName.equals(table)) {
                return Optional.of(partition);
            }
        }
        return Optional.empty();
    }
}
