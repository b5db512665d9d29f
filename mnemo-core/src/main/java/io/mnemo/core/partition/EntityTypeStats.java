package io.mnemo.core.partition;

import java.time.Instant;

public record EntityTypeStats(
    String entityType,
    long entityCount,
    double averageConfidence,
    Instant oldestCreatedAt,
    Instant newestCreatedAt,
    Instant refreshedAt
) {
}
