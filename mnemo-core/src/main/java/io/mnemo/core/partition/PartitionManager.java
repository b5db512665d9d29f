package io.mnemo.core.partition;

import io.mnemo.core.config.model.PartitionConfig;
import io.mnemo.core.graph.EntityTable;
import io.mnemo.core.graph.LocatedEntity;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.PooledConnection;
import io.mnemo.core.storage.Rows;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves entity rows between the age partitions and refreshes the summary tables.
 *
 * <p>A pass runs in one transaction: rows aged out of {@code recent} move to
 * {@code intermediate}, then rows aged out of {@code intermediate} move to {@code archive},
 * then the summaries are rebuilt. Only one pass runs at a time. Scheduled passes that fail are
 * logged and retried after the configured retry delay; they never reach serving callers.
 */
public final class PartitionManager {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionManager.class);
    private static final String COLUMNS = EntityTable.COLUMNS;

    private static final String REFRESH_ENTITY_STATS = "INSERT INTO mv_entity_stats"
        + " (entity_type, entity_count, avg_confidence, oldest_created_at, newest_created_at, refreshed_at)"
        + " SELECT entity_type, COUNT(*), AVG(confidence_score), MIN(created_at), MAX(created_at), ?"
        + " FROM (" + Partition.unionAll("entity_type, confidence_score, created_at", null) + ")"
        + " GROUP BY entity_type";
    private static final String REFRESH_RELATION_SUMMARY = """
        INSERT INTO mv_relation_summary
            (relation_type, relation_count, distinct_sources, distinct_targets, avg_confidence, refreshed_at)
        SELECT relation_type, COUNT(*), COUNT(DISTINCT from_entity), COUNT(DISTINCT to_entity), AVG(confidence_score), ?
        FROM relations
        GROUP BY relation_type
        """;
    private static final String ENTITY_STATS = """
        SELECT entity_type, entity_count, avg_confidence, oldest_created_at, newest_created_at, refreshed_at
        FROM mv_entity_stats ORDER BY entity_count DESC, entity_type
        """;
    private static final String RELATION_SUMMARY = """
        SELECT relation_type, relation_count, distinct_sources, distinct_targets, avg_confidence, refreshed_at
        FROM mv_relation_summary ORDER BY relation_count DESC, relation_type
        """;

    private final StorageContext context;
    private final EntityTable entities;
    private final PartitionConfig config;
    private final ReentrantLock maintenanceLock = new ReentrantLock();
    private ScheduledExecutorService scheduler;

    public PartitionManager(StorageContext context, EntityTable entities) {
        this.context = context;
        this.entities = entities;
        this.config = context.config().partitions();
        if (config.recentDays() <= 0 || config.archiveAfterDays() <= config.recentDays()) {
            throw new IllegalArgumentException("partitions require 0 < recentDays < archiveAfterDays");
        }
    }

    /**
     * Runs one maintenance pass now. Returns a skipped report if a pass is already in flight.
     */
    public StoreResult<MaintenanceReport> runMaintenance() {
        Instant startedAt = context.clock().instant();
        if (!maintenanceLock.tryLock()) {
            LOG.debug("Partition maintenance already running; skipping");
            return StoreResult.ok(MaintenanceReport.skipped(startedAt));
        }
        try {
            long started = System.nanoTime();
            StoreResult<MaintenanceReport> result = context.transaction("partition_maintenance", handle -> {
                long now = context.clock().millis();
                long recentCutoff = now - Duration.ofDays(config.recentDays()).toMillis();
                long archiveCutoff = now - Duration.ofDays(config.archiveAfterDays()).toMillis();
                int toIntermediate = move(handle, Partition.RECENT, Partition.INTERMEDIATE, recentCutoff);
                int toArchive = move(handle, Partition.INTERMEDIATE, Partition.ARCHIVE, archiveCutoff);
                int entityTypes = refresh(handle, "mv_entity_stats", REFRESH_ENTITY_STATS, now);
                int relationTypes = refresh(handle, "mv_relation_summary", REFRESH_RELATION_SUMMARY, now);
                return StoreResult.ok(new MaintenanceReport(
                    startedAt,
                    Duration.ofNanos(System.nanoTime() - started).toMillis(),
                    toIntermediate,
                    toArchive,
                    entityTypes,
                    relationTypes,
                    false
                ));
            });
            if (result.isOk()) {
                optimize();
                MaintenanceReport report = result.value();
                LOG.info(
                    "Partition maintenance moved {} rows to intermediate and {} rows to archive in {} ms",
                    report.movedToIntermediate(),
                    report.movedToArchive(),
                    report.durationMillis()
                );
            }
            return result;
        } finally {
            maintenanceLock.unlock();
        }
    }

    /**
     * Schedules maintenance on {@code executor}, first after one interval. The executor stays
     * owned by the caller.
     */
    public synchronized void start(ScheduledExecutorService executor) {
        if (scheduler != null) {
            throw new IllegalStateException("Partition maintenance is already scheduled");
        }
        scheduler = executor;
        scheduleNext(Duration.ofSeconds(config.maintenanceIntervalSeconds()));
        LOG.info("Partition maintenance scheduled every {} s", config.maintenanceIntervalSeconds());
    }

    public synchronized void stop() {
        scheduler = null;
    }

    public synchronized boolean isScheduled() {
        return scheduler != null;
    }

    boolean isRunning() {
        return maintenanceLock.isLocked();
    }

    void tick() {
        Duration next = Duration.ofSeconds(config.maintenanceIntervalSeconds());
        try {
            StoreResult<MaintenanceReport> result = runMaintenance();
            if (result.isFailure()) {
                next = Duration.ofSeconds(config.maintenanceRetryDelaySeconds());
                LOG.warn("Partition maintenance failed, retrying in {} s: {}", next.toSeconds(), result.error());
            }
        } catch (RuntimeException e) {
            next = Duration.ofSeconds(config.maintenanceRetryDelaySeconds());
            LOG.error("Partition maintenance crashed, retrying in {} s", next.toSeconds(), e);
        }
        scheduleNext(next);
    }

    public StoreResult<Optional<Partition>> partitionOf(String name) {
        String entityName = Sanitizer.identity(name);
        if (entityName.isEmpty()) {
            return StoreResult.failure(StoreError.invalidArgument("entity name must not be empty"));
        }
        return context.read("partition_of", handle ->
            StoreResult.ok(entities.find(handle, entityName).map(LocatedEntity::partition)));
    }

    public StoreResult<Map<Partition, Long>> partitionCounts() {
        return context.read("partition_counts", handle -> {
            Map<Partition, Long> counts = new EnumMap<>(Partition.class);
            for (Partition partition : Partition.values()) {
                PreparedStatement statement = handle.prepare("SELECT COUNT(*) FROM " + partition.tableName());
                try (ResultSet resultSet = statement.executeQuery()) {
                    counts.put(partition, resultSet.next() ? resultSet.getLong(1) : 0L);
                }
            }
            return StoreResult.ok(counts);
        });
    }

    public StoreResult<List<EntityTypeStats>> entityStatistics() {
        return context.read("entity_statistics", handle -> {
            List<EntityTypeStats> stats = new ArrayList<>();
            try (ResultSet resultSet = handle.prepare(ENTITY_STATS).executeQuery()) {
                while (resultSet.next()) {
                    stats.add(new EntityTypeStats(
                        resultSet.getString("entity_type"),
                        resultSet.getLong("entity_count"),
                        resultSet.getDouble("avg_confidence"),
                        Rows.instant(resultSet, "oldest_created_at"),
                        Rows.instant(resultSet, "newest_created_at"),
                        Rows.instant(resultSet, "refreshed_at")
                    ));
                }
            }
            return StoreResult.ok(stats);
        });
    }

    public StoreResult<List<RelationTypeSummary>> relationSummary() {
        return context.read("relation_summary", handle -> {
            List<RelationTypeSummary> summary = new ArrayList<>();
            try (ResultSet resultSet = handle.prepare(RELATION_SUMMARY).executeQuery()) {
                while (resultSet.next()) {
                    summary.add(new RelationTypeSummary(
                        resultSet.getString("relation_type"),
                        resultSet.getLong("relation_count"),
                        resultSet.getLong("distinct_sources"),
                        resultSet.getLong("distinct_targets"),
                        resultSet.getDouble("avg_confidence"),
                        Rows.instant(resultSet, "refreshed_at")
                    ));
                }
            }
            return StoreResult.ok(summary);
        });
    }

    private int move(PooledConnection handle, Partition source, Partition target, long cutoffMillis) throws SQLException {
        PreparedStatement copy = handle.prepare(
            "INSERT INTO " + target.tableName() + " (" + COLUMNS + ") SELECT " + COLUMNS
                + " FROM " + source.tableName() + " WHERE created_at <= ?"
        );
        copy.setLong(1, cutoffMillis);
        int copied = copy.executeUpdate();

        PreparedStatement remove = handle.prepare("DELETE FROM " + source.tableName() + " WHERE created_at <= ?");
        remove.setLong(1, cutoffMillis);
        int removed = remove.executeUpdate();
        if (copied != removed) {
            throw new SQLException("Partition move " + source.wireName() + " -> " + target.wireName()
                + " copied " + copied + " rows but removed " + removed);
        }
        return copied;
    }

    private int refresh(PooledConnection handle, String table, String rebuild, long now) throws SQLException {
        handle.prepare("DELETE FROM " + table).executeUpdate();
        PreparedStatement statement = handle.prepare(rebuild);
        statement.setLong(1, now);
        return statement.executeUpdate();
    }

    private void optimize() {
        StoreResult<Boolean> result = context.read("optimize", handle -> {
            try (Statement statement = handle.connection().createStatement()) {
                statement.execute("PRAGMA optimize");
            }
            return StoreResult.ok(Boolean.TRUE);
        });
        if (result.isFailure()) {
            LOG.warn("PRAGMA optimize failed: {}", result.error());
        }
    }

    private synchronized void scheduleNext(Duration delay) {
        ScheduledExecutorService current = scheduler;
        if (current == null || current.isShutdown()) {
            return;
        }
        try {
            current.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Partition maintenance not rescheduled: {}", e.getMessage());
        }
    }
}
