package io.mnemo.core.temporal;

import io.mnemo.core.model.Entity;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record EntityVersion(
    String entityName,
    String entityType,
    List<String> observations,
    double confidenceScore,
    String contextSource,
    Map<String, Object> metadata,
    Integer categoryId,
    Instant createdAt,
    int versionNumber,
    ChangeType changeType,
    Instant validFrom,
    Instant validUntil,
    String changedBy
) {

    public EntityVersion {
        observations = observations == null ? List.of() : List.copyOf(observations);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public boolean contains(Instant t) {
        return !validFrom.isAfter(t) && (validUntil == null || t.isBefore(validUntil));
    }

    public Entity toEntity() {
        return new Entity(
            entityName,
            entityType,
            observations,
            confidenceScore,
            contextSource,
            metadata,
            createdAt,
            validFrom,
            categoryId
        );
    }
}
