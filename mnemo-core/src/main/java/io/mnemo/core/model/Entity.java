package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named node of the knowledge graph. The confidence score is clamped into {@code [0, 1]} on
 * construction and defaults to {@code 1.0} when absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Entity(
    String name,
    String entityType,
    List<String> observations,
    Double confidenceScore,
    String contextSource,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant lastUpdated,
    Integer categoryId
) {

    public Entity {
        observations = observations == null ? List.of() : List.copyOf(observations);
        confidenceScore = clampConfidence(confidenceScore);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Entity of(String name, String entityType, List<String> observations) {
        return new Entity(name, entityType, observations, null, null, null, null, null, null);
    }

    public Entity withObservations(List<String> updated, Instant now) {
        return new Entity(name, entityType, updated, confidenceScore, contextSource, metadata, createdAt, now, categoryId);
    }

    public Entity withTimestamps(Instant created, Instant updated) {
        return new Entity(name, entityType, observations, confidenceScore, contextSource, metadata, created, updated, categoryId);
    }

    static Double clampConfidence(Double value) {
        if (value == null) {
            return 1.0;
        }
        if (value.isNaN()) {
            return value;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
