package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Relation(
    String from,
    String to,
    String relationType,
    Double confidenceScore,
    String contextSource,
    Instant createdAt,
    Instant validFrom,
    Instant validUntil
) {

    public Relation {
        confidenceScore = Entity.clampConfidence(confidenceScore);
    }

    public static Relation of(String from, String to, String relationType) {
        return new Relation(from, to, relationType, null, null, null, null, null);
    }

    public RelationKey key() {
        return new RelationKey(from, to, relationType);
    }

    public Relation withTimestamps(Instant created, Instant from) {
        return new Relation(this.from, to, relationType, confidenceScore, contextSource, created, from, validUntil);
    }
}
