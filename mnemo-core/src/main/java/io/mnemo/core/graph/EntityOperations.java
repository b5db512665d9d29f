package io.mnemo.core.graph;

import io.mnemo.core.config.model.PartitionConfig;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.ObservationAddition;
import io.mnemo.core.model.ObservationDeletion;
import io.mnemo.core.model.Relation;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import io.mnemo.core.temporal.ChangeType;
import io.mnemo.core.temporal.VersionRecorder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class EntityOperations {
    private final StorageContext context;
    private final EntityTable entities;
    private final RelationTable relations;
    private final VersionRecorder versions;
    private final PartitionConfig partitions;

    public EntityOperations(StorageContext context, EntityTable entities, RelationTable relations, VersionRecorder versions) {
        this.context = context;
        this.entities = entities;
        this.relations = relations;
        this.versions = versions;
        this.partitions = context.config().partitions();
    }

    public StoreResult<List<Entity>> createEntities(List<Entity> input, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (input == null || input.isEmpty()) {
            return StoreResult.ok(List.of());
        }
        List<Entity> prepared = new ArrayList<>(input.size());
        Set<String> seen = new HashSet<>();
        for (Entity raw : input) {
            Entity entity = raw == null ? null : sanitize(raw);
            Optional<StoreError> invalid = Validator.entity(entity);
            if (invalid.isPresent()) {
                return StoreResult.failure(invalid.get());
            }
            if (!seen.add(entity.name())) {
                return StoreResult.failure(StoreError.entityAlreadyExists(entity.name()));
            }
            prepared.add(entity);
        }

        return context.write("create_entities", handle -> {
            Instant now = context.clock().instant();
            List<Entity> created = new ArrayList<>(prepared.size());
            for (List<Entity> batch : Batches.of(prepared, batchSize)) {
                List<LocatedEntity> existing = entities.findAll(handle, batch.stream().map(Entity::name).toList());
                if (!existing.isEmpty()) {
                    return StoreResult.failure(StoreError.entityAlreadyExists(existing.get(0).entity().name()));
                }
                for (Entity entity : batch) {
                    if (entity.categoryId() != null && !CategoryOperations.exists(handle, entity.categoryId())) {
                        return StoreResult.failure(StoreError.invalidArgument("Unknown category id: " + entity.categoryId()));
                    }
                    Instant createdAt = entity.createdAt() == null ? now : entity.createdAt();
                    Entity row = entity.withTimestamps(createdAt, now);
                    entities.insert(handle, partitionFor(createdAt, now), row);
                    versions.recordEntity(handle, row, ChangeType.CREATE, now);
                    created.add(row);
                }
            }
            return StoreResult.ok(created);
        });
    }

    public StoreResult<Map<String, List<String>>> addObservations(List<ObservationAddition> input, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (input == null || input.isEmpty()) {
            return StoreResult.ok(Map.of());
        }
        List<ObservationAddition> prepared = new ArrayList<>(input.size());
        for (ObservationAddition raw : input) {
            String name = raw == null ? "" : Sanitizer.identity(raw.entityName());
            Optional<StoreError> invalid = Validator.name(name);
            if (invalid.isPresent()) {
                return StoreResult.failure(invalid.get());
            }
            prepared.add(new ObservationAddition(name, raw.contents()));
        }

        return context.write("add_observations", handle -> {
            Instant now = context.clock().instant();
            Map<String, List<String>> added = new LinkedHashMap<>();
            for (List<ObservationAddition> batch : Batches.of(prepared, batchSize)) {
                for (ObservationAddition addition : batch) {
                    Optional<LocatedEntity> located = entities.find(handle, addition.entityName());
                    if (located.isEmpty()) {
                        return StoreResult.failure(StoreError.entityNotFound(addition.entityName()));
                    }
                    added.computeIfAbsent(addition.entityName(), ignored -> new ArrayList<>()).addAll(addition.contents());
                    if (addition.contents().isEmpty()) {
                        continue;
                    }
                    Entity current = located.get().entity();
                    List<String> merged = new ArrayList<>(current.observations());
                    merged.addAll(addition.contents());
                    Entity updated = current.withObservations(merged, now);
                    entities.updateObservations(handle, located.get(), updated);
                    versions.recordEntity(handle, updated, ChangeType.UPDATE, now);
                }
            }
            return StoreResult.ok(added);
        });
    }

    public StoreResult<List<String>> deleteEntities(List<String> names, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (names == null || names.isEmpty()) {
            return StoreResult.ok(List.of());
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : names) {
            String name = Sanitizer.identity(raw);
            Optional<StoreError> invalid = Validator.name(name);
            if (invalid.isPresent()) {
                return StoreResult.failure(invalid.get());
            }
            unique.add(name);
        }

        return context.write("delete_entities", handle -> {
            Instant now = context.clock().instant();
            List<String> deleted = new ArrayList<>();
            for (List<String> batch : Batches.of(List.copyOf(unique), batchSize)) {
                List<LocatedEntity> located = entities.findAll(handle, batch);
                if (located.isEmpty()) {
                    continue;
                }
                List<String> present = located.stream().map(found -> found.entity().name()).toList();
                for (Relation relation : relations.touching(handle, present)) {
                    if (relations.delete(handle, relation.key())) {
                        versions.recordRelation(handle, relation, ChangeType.DELETE, now);
                    }
                }
                for (LocatedEntity entity : located) {
                    if (entities.delete(handle, entity)) {
                        versions.recordEntity(handle, entity.entity(), ChangeType.DELETE, now);
                        deleted.add(entity.entity().name());
                    }
                }
            }
            return StoreResult.ok(deleted);
        });
    }

    public StoreResult<Map<String, List<String>>> deleteObservations(List<ObservationDeletion> input, int batchSize) {
        if (batchSize <= 0) {
            return StoreResult.failure(StoreError.invalidArgument("batchSize must be > 0"));
        }
        if (input == null || input.isEmpty()) {
            return StoreResult.ok(Map.of());
        }
        List<ObservationDeletion> prepared = new ArrayList<>(input.size());
        for (ObservationDeletion raw : input) {
            String name = raw == null ? "" : Sanitizer.identity(raw.entityName());
            Optional<StoreError> invalid = Validator.name(name);
            if (invalid.isPresent()) {
                return StoreResult.failure(invalid.get());
            }
            prepared.add(new ObservationDeletion(name, raw.observations()));
        }

        return context.write("delete_observations", handle -> {
            Instant now = context.clock().instant();
            Map<String, List<String>> removed = new LinkedHashMap<>();
            for (List<ObservationDeletion> batch : Batches.of(prepared, batchSize)) {
                for (ObservationDeletion deletion : batch) {
                    Optional<LocatedEntity> located = entities.find(handle, deletion.entityName());
                    if (located.isEmpty()) {
                        continue;
                    }
                    Set<String> targets = new HashSet<>(deletion.observations());
                    Entity current = located.get().entity();
                    List<String> remaining = new ArrayList<>();
                    List<String> dropped = new ArrayList<>();
                    for (String observation : current.observations()) {
                        if (targets.contains(observation)) {
                            dropped.add(observation);
                        } else {
                            remaining.add(observation);
                        }
                    }
                    if (dropped.isEmpty()) {
                        continue;
                    }
                    Entity updated = current.withObservations(remaining, now);
                    entities.updateObservations(handle, located.get(), updated);
                    versions.recordEntity(handle, updated, ChangeType.UPDATE, now);
                    removed.computeIfAbsent(deletion.entityName(), ignored -> new ArrayList<>()).addAll(dropped);
                }
            }
            return StoreResult.ok(removed);
        });
    }

    public StoreResult<Optional<Entity>> getEntity(String name) {
        String entityName = Sanitizer.identity(name);
        Optional<StoreError> invalid = Validator.name(entityName);
        if (invalid.isPresent()) {
            return StoreResult.failure(invalid.get());
        }
        return context.read("get_entity", handle ->
            StoreResult.ok(entities.find(handle, entityName).map(LocatedEntity::entity)));
    }

    private Partition partitionFor(Instant createdAt, Instant now) {
        return Partition.forAge(createdAt, now, partitions.recentDays(), partitions.archiveAfterDays());
    }

    private Entity sanitize(Entity raw) {
        return new Entity(
            Sanitizer.identity(raw.name()),
            Sanitizer.identity(raw.entityType()),
            raw.observations(),
            raw.confidenceScore(),
            raw.contextSource(),
            raw.metadata(),
            raw.createdAt(),
            raw.lastUpdated(),
            raw.categoryId()
        );
    }
}
