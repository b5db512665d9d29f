package io.mnemo.core.graph;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.model.Category;
import io.mnemo.core.model.Direction;
import io.mnemo.core.model.Entity;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.model.ObservationAddition;
import io.mnemo.core.model.ObservationDeletion;
import io.mnemo.core.model.Relation;
import io.mnemo.core.model.RelationKey;
import io.mnemo.core.observability.HealthReport;
import io.mnemo.core.observability.MetricsSnapshot;
import io.mnemo.core.partition.EntityTypeStats;
import io.mnemo.core.partition.MaintenanceReport;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.partition.PartitionManager;
import io.mnemo.core.partition.RelationTypeSummary;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.StorageContext;
import io.mnemo.core.temporal.ChangeType;
import io.mnemo.core.temporal.EntityVersion;
import io.mnemo.core.temporal.RelationVersion;
import io.mnemo.core.temporal.TemporalOperations;
import io.mnemo.core.temporal.VersionRecorder;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class KnowledgeGraphStore implements AutoCloseable {
    private final StorageContext context;
    private final int defaultBatchSize;
    private final EntityOperations entityOperations;
    private final RelationOperations relationOperations;
    private final SearchOperations searchOperations;
    private final CategoryOperations categoryOperations;
    private final TemporalOperations temporalOperations;
    private final PartitionManager partitionManager;

    public KnowledgeGraphStore(StorageContext context) {
        this.context = context;
        this.defaultBatchSize = context.config().storage().batchSize();
        EntityTable entities = new EntityTable(context.json());
        RelationTable relations = new RelationTable(context.json());
        VersionRecorder versions = new VersionRecorder(context.json(), context.config().storage().changedBy());
        this.entityOperations = new EntityOperations(context, entities, relations, versions);
        this.relationOperations = new RelationOperations(context, entities, relations, versions);
        this.searchOperations = new SearchOperations(context, entities, relations);
        this.categoryOperations = new CategoryOperations(context);
        this.temporalOperations = new TemporalOperations(context);
        this.partitionManager = new PartitionManager(context, entities);
    }

    public static KnowledgeGraphStore open(MnemoConfig config, Clock clock) throws IOException {
        return new KnowledgeGraphStore(StorageContext.open(config, clock));
    }

    public StoreResult<List<Entity>> createEntities(List<Entity> entities) {
        return createEntities(entities, defaultBatchSize);
    }

    public StoreResult<List<Entity>> createEntities(List<Entity> entities, int batchSize) {
        return entityOperations.createEntities(entities, batchSize);
    }

    public StoreResult<Map<String, List<String>>> addObservations(List<ObservationAddition> additions) {
        return addObservations(additions, defaultBatchSize);
    }

    public StoreResult<Map<String, List<String>>> addObservations(List<ObservationAddition> additions, int batchSize) {
        return entityOperations.addObservations(additions, batchSize);
    }

    public StoreResult<List<String>> deleteEntities(List<String> names) {
        return deleteEntities(names, defaultBatchSize);
    }

    public StoreResult<List<String>> deleteEntities(List<String> names, int batchSize) {
        return entityOperations.deleteEntities(names, batchSize);
    }

    public StoreResult<Map<String, List<String>>> deleteObservations(List<ObservationDeletion> deletions) {
        return deleteObservations(deletions, defaultBatchSize);
    }

    public StoreResult<Map<String, List<String>>> deleteObservations(List<ObservationDeletion> deletions, int batchSize) {
        return entityOperations.deleteObservations(deletions, batchSize);
    }

    public StoreResult<List<Relation>> createRelations(List<Relation> relations) {
        return createRelations(relations, defaultBatchSize);
    }

    public StoreResult<List<Relation>> createRelations(List<Relation> relations, int batchSize) {
        return relationOperations.createRelations(relations, batchSize);
    }

    public StoreResult<List<RelationKey>> deleteRelations(List<RelationKey> relations) {
        return deleteRelations(relations, defaultBatchSize);
    }

    public StoreResult<List<RelationKey>> deleteRelations(List<RelationKey> relations, int batchSize) {
        return relationOperations.deleteRelations(relations, batchSize);
    }

    public StoreResult<KnowledgeGraph> searchNodes(String query) {
        return searchOperations.searchNodes(query);
    }

    public StoreResult<KnowledgeGraph> openNodes(List<String> names) {
        return searchOperations.openNodes(names);
    }

    public StoreResult<KnowledgeGraph> readGraph() {
        return searchOperations.readGraph();
    }

    public StoreResult<Optional<Entity>> getEntity(String name) {
        return entityOperations.getEntity(name);
    }

    public StoreResult<Optional<EntityVersion>> getEntityAtTime(String name, Instant t) {
        return temporalOperations.getEntityAtTime(name, t);
    }

    public StoreResult<List<EntityVersion>> getEntityChanges(String name, Instant start, Instant end) {
        return temporalOperations.getEntityChanges(name, start, end);
    }

    public StoreResult<List<RelationVersion>> getRelationsAtTime(String name, Instant t, Direction direction) {
        return temporalOperations.getRelationsAtTime(name, t, direction);
    }

    public StoreResult<Optional<RelationVersion>> getRelationAtTime(String from, String to, String relationType, Instant t) {
        return temporalOperations.getRelationAtTime(from, to, relationType, t);
    }

    public StoreResult<List<RelationVersion>> getRelationHistory(String from, String to, String relationType, Instant start, Instant end) {
        return temporalOperations.getRelationHistory(from, to, relationType, start, end);
    }

    public StoreResult<List<EntityVersion>> getChangesInPeriod(Instant start, Instant end, String entityType, ChangeType changeType) {
        return temporalOperations.getChangesInPeriod(start, end, entityType, changeType);
    }

    public StoreResult<KnowledgeGraph> getGraphAtTime(Instant t) {
        return temporalOperations.getGraphAtTime(t);
    }

    public StoreResult<Category> createCategory(String name, int priority, Integer retentionDays) {
        return categoryOperations.createCategory(name, priority, retentionDays);
    }

    public StoreResult<List<Category>> listCategories() {
        return categoryOperations.listCategories();
    }

    public StoreResult<MaintenanceReport> runMaintenance() {
        return partitionManager.runMaintenance();
    }

    public StoreResult<Optional<Partition>> partitionOf(String name) {
        return partitionManager.partitionOf(name);
    }

    public StoreResult<Map<Partition, Long>> partitionCounts() {
        return partitionManager.partitionCounts();
    }

    public StoreResult<List<EntityTypeStats>> entityStatistics() {
        return partitionManager.entityStatistics();
    }

    public StoreResult<List<RelationTypeSummary>> relationSummary() {
        return partitionManager.relationSummary();
    }

    public PartitionManager partitionManager() {
        return partitionManager;
    }

    public MetricsSnapshot metrics() {
        return context.metricsSnapshot();
    }

    public HealthReport health() {
        return context.health();
    }

    public StorageContext context() {
        return context;
    }

    @Override
    public void close() {
        partitionManager.stop();
        context.close();
    }
}
