package io.mnemo.core.observability;

import io.mnemo.core.storage.PoolStats;
import java.time.Instant;

public record HealthReport(
    String status,
    Instant checkedAt,
    String databasePath,
    long databaseBytes,
    long walBytes,
    PoolStats pool
) {

    public long storageBytes() {
        return databaseBytes + walBytes;
    }
}
