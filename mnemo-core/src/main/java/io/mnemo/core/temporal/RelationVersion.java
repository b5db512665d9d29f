package io.mnemo.core.temporal;

import io.mnemo.core.model.Relation;
import java.time.Instant;

public record RelationVersion(
    String from,
    String to,
    String relationType,
    double confidenceScore,
    String contextSource,
    Instant createdAt,
    Instant effectiveFrom,
    Instant effectiveUntil,
    int versionNumber,
    ChangeType changeType,
    Instant validFrom,
    Instant validUntil,
    String changedBy
) {

    public Relation toRelation() {
        return new Relation(from, to, relationType, confidenceScore, contextSource, createdAt, effectiveFrom, effectiveUntil);
    }
}
