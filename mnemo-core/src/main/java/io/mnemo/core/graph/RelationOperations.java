package io.mnemo.core.graph;

import io.mnemo.core.model.Relation;
import io.mnemo.core.model.RelationKey;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import io.mnemo.core.temporal.ChangeType;
import io.mnemo.core.temporal.VersionRecorder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public final class RelationOperations {
    private final StorageContext context;
    private final EntityTable entities;
    private final RelationTable relations;
    private final VersionRecorder versions;

    public RelationOperations(StorageContext context, EntityTable entities, RelationTable relations, VersionRecorder versions) {
        this.context = context;
        this.entities = entities;
        this.relations = relations;
        this.versions = versions;
    }

    public StoreResult<List<Relation>> createRelations(List<Relation> input, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (input == null || input.isEmpty()) {
            return StoreResult.ok(List.of());
        }
        List<Relation> prepared = new ArrayList<>(input.size());
        for (Relation raw : input) {
            Relation relation = raw == null ? null : sanitize(raw);
            Optional<StoreError> invalid = Validator.relation(relation);
            if (invalid.isPresent()) {
                return StoreResult.failure(invalid.get());
            }
            prepared.add(relation);
        }

        return context.write("create_relations", handle -> {
            Instant now = context.clock().instant();
            List<Relation> created = new ArrayList<>();
            for (List<Relation> batch : Batches.of(prepared, batchSize)) {
                Set<String> endpoints = new LinkedHashSet<>();
                for (Relation relation : batch) {
                    endpoints.add(relation.from());
                    endpoints.add(relation.to());
                }
                Set<String> existing = entities.findAll(handle, endpoints).stream()
                    .map(found -> found.entity().name())
                    .collect(Collectors.toSet());
                for (Relation relation : batch) {
                    if (!existing.contains(relation.from())) {
                        return StoreResult.failure(StoreError.entityNotFound(relation.from()));
                    }
                    if (!existing.contains(relation.to())) {
                        return StoreResult.failure(StoreError.entityNotFound(relation.to()));
                    }
                    Relation row = relation.withTimestamps(now, relation.validFrom() == null ? now : relation.validFrom());
                    if (relations.insertIfAbsent(handle, row)) {
                        versions.recordRelation(handle, row, ChangeType.CREATE, now);
                        created.add(row);
                    }
                }
            }
            return StoreResult.ok(created);
        });
    }

    public StoreResult<List<RelationKey>> deleteRelations(List<RelationKey> input, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (input == null || input.isEmpty()) {
            return StoreResult.ok(List.of());
        }
        List<RelationKey> prepared = new ArrayList<>(input.size());
        for (RelationKey raw : input) {
            if (raw == null) {
                return StoreResult.failure(StoreError.invalidArgument("relation must not be null"));
            }
            RelationKey key = new RelationKey(
                Sanitizer.identity(raw.from()),
                Sanitizer.identity(raw.to()),
                Sanitizer.identity(raw.relationType())
            );
            if (key.from().isEmpty() || key.to().isEmpty() || key.relationType().isEmpty()) {
                return StoreResult.failure(StoreError.invalidArgument("from, to and relationType are required"));
            }
            prepared.add(key);
        }

        return context.write("delete_relations", handle -> {
            Instant now = context.clock().instant();
            List<RelationKey> deleted = new ArrayList<>();
            for (List<RelationKey> batch : Batches.of(prepared, batchSize)) {
                for (RelationKey key : batch) {
                    Optional<Relation> current = relations.find(handle, key);
                    if (current.isPresent() && relations.delete(handle, key)) {
                        versions.recordRelation(handle, current.get(), ChangeType.DELETE, now);
                        deleted.add(key);
                    }
                }
            }
            return StoreResult.ok(deleted);
        });
    }

    private Relation sanitize(Relation raw) {
        return new Relation(
            Sanitizer.identity(raw.from()),
            Sanitizer.identity(raw.to()),
            Sanitizer.identity(raw.relationType()),
            raw.confidenceScore(),
            raw.contextSource(),
            raw.createdAt(),
            raw.validFrom(),
            raw.validUntil()
        );
    }
}
