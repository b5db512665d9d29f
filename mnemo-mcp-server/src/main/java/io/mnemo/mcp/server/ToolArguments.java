package io.mnemo.mcp.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.ObservationAddition;
import io.mnemo.core.model.ObservationDeletion;
import io.mnemo.core.model.Relation;
import io.mnemo.core.model.RelationKey;
import java.time.Instant;
import java.util.List;

final class ToolArguments {

    private ToolArguments() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entities(List<Entity> entities, Integer batchSize) {
        Entities {
            entities = entities == null ? List.of() : entities;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Additions(List<ObservationAddition> observations, Integer batchSize) {
        Additions {
            observations = observations == null ? List.of() : observations;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntityNames(List<String> entityNames, Integer batchSize) {
        EntityNames {
            entityNames = entityNames == null ? List.of() : entityNames;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Deletions(List<ObservationDeletion> deletions, Integer batchSize) {
        Deletions {
            deletions = deletions == null ? List.of() : deletions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Relations(List<Relation> relations, Integer batchSize) {
        Relations {
            relations = relations == null ? List.of() : relations;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RelationKeys(List<RelationKey> relations, Integer batchSize) {
        RelationKeys {
            relations = relations == null ? List.of() : relations;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Query(String query) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Names(List<String> names) {
        Names {
            names = names == null ? List.of() : names;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntityQuery(String name, Instant timestamp, Instant start, Instant end, String direction) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RelationQuery(String from, String to, String relationType, Instant timestamp, Instant start, Instant end) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Period(Instant start, Instant end, String entityType, String changeType) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PointInTime(Instant timestamp) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NewCategory(String name, Integer priority, Integer retentionDays) {
    }
}
