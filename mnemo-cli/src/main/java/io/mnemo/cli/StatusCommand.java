package io.mnemo.cli;

import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.observability.HealthReport;
import io.mnemo.core.partition.EntityTypeStats;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.storage.PoolStats;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show store health, pool counters and partition statistics")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--json", description = "Print the status as JSON")
    boolean json;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (KnowledgeGraphStore store = context.openStore()) {
            HealthReport health = store.health();
            Map<Partition, Long> partitions = store.partitionCounts().orElseThrow();
            if (json) {
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("configPath", context.configPath().toString());
                status.put("health", health);
                status.put("partitions", partitions);
                status.put("entityTypes", store.entityStatistics().orElseThrow());
                status.put("relationTypes", store.relationSummary().orElseThrow());
                status.put("metrics", store.metrics());
                System.out.println(context.configService().toPrettyJson(status));
                return 0;
            }

            PoolStats pool = health.pool();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + health.databasePath());
            System.out.println("Status: " + health.status());
            System.out.println("Storage bytes: " + health.storageBytes() + " (wal " + health.walBytes() + ")");
            System.out.println("Pool: " + pool.active() + " active, " + pool.available() + " available, "
                + pool.maxSize() + " max, " + pool.acquireTimeouts() + " timeouts");
            for (Partition partition : Partition.values()) {
                System.out.println("Partition " + partition.wireName() + ": " + partitions.getOrDefault(partition, 0L));
            }
            for (EntityTypeStats stats : store.entityStatistics().orElseThrow()) {
                System.out.println("Type " + stats.entityType() + ": " + stats.entityCount()
                    + " entities, avg confidence " + stats.averageConfidence());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
