package io.mnemo.core.partition;

import java.time.Instant;

public record RelationTypeSummary(
    String relationType,
    long relationCount,
    long distinctSources,
    long distinctTargets,
    double averageConfidence,
    Instant refreshedAt
) {
}
