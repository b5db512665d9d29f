package io.mnemo.core.observability;

import io.mnemo.core.storage.PoolStats;
import java.time.Instant;
import java.util.Map;

public record MetricsSnapshot(
    Instant generatedAt,
    PoolStats pool,
    long resultCacheSize,
    long resultCacheHits,
    long resultCacheMisses,
    Map<String, OperationMetrics> operations
) {

    public MetricsSnapshot {
        operations = operations == null ? Map.of() : Map.copyOf(operations);
    }
}
