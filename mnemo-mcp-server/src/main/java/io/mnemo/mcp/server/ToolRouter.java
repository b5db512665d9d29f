package io.mnemo.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.model.Direction;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.temporal.ChangeType;
import io.mnemo.mcp.server.model.ToolCallResponse;
import io.mnemo.mcp.server.model.ToolDefinition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolRouter {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRouter.class);

    private final KnowledgeGraphStore store;
    private final ObjectMapper mapper;
    private final int defaultBatchSize;

    public ToolRouter(KnowledgeGraphStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
        this.defaultBatchSize = store.context().config().storage().batchSize();
    }

    public List<ToolDefinition> listTools() {
        List<ToolDefinition> all = new ArrayList<>();
        for (GraphOperation operation : GraphOperation.values()) {
            all.add(new ToolDefinition(
                operation.wireName(),
                operation.description(),
                operation.inputSchema(),
                operation.group(),
                operation.mutating()
            ));
        }
        all.sort(Comparator.comparing(ToolDefinition::name));
        return all;
    }

    public ToolCallResponse callTool(String toolName, Map<String, Object> arguments) {
        Optional<GraphOperation> operation = GraphOperation.fromWireName(toolName);
        if (operation.isEmpty()) {
            return ToolCallResponse.error("Unknown tool: " + toolName);
        }
        StoreResult<?> result;
        try {
            result = dispatch(operation.get(), arguments == null ? Map.of() : arguments);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected arguments for {}: {}", toolName, e.getMessage());
            return ToolCallResponse.error(StoreError.invalidArgument("Invalid arguments for " + toolName + ": " + e.getMessage()));
        }
        if (result.isFailure()) {
            return ToolCallResponse.error(result.error());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("result", unwrap(result.value()));
        return ToolCallResponse.ok(operation.get().wireName(), data);
    }

    private StoreResult<?> dispatch(GraphOperation operation, Map<String, Object> arguments) {
        return switch (operation) {
            case CREATE_ENTITIES -> {
                ToolArguments.Entities args = bind(arguments, ToolArguments.Entities.class);
                yield store.createEntities(args.entities(), batch(args.batchSize()));
            }
            case ADD_OBSERVATIONS -> {
                ToolArguments.Additions args = bind(arguments, ToolArguments.Additions.class);
                yield store.addObservations(args.observations(), batch(args.batchSize()));
            }
            case DELETE_ENTITIES -> {
                ToolArguments.EntityNames args = bind(arguments, ToolArguments.EntityNames.class);
                yield store.deleteEntities(args.entityNames(), batch(args.batchSize()));
            }
            case DELETE_OBSERVATIONS -> {
                ToolArguments.Deletions args = bind(arguments, ToolArguments.Deletions.class);
                yield store.deleteObservations(args.deletions(), batch(args.batchSize()));
            }
            case CREATE_RELATIONS -> {
                ToolArguments.Relations args = bind(arguments, ToolArguments.Relations.class);
                yield store.createRelations(args.relations(), batch(args.batchSize()));
            }
            case DELETE_RELATIONS -> {
                ToolArguments.RelationKeys args = bind(arguments, ToolArguments.RelationKeys.class);
                yield store.deleteRelations(args.relations(), batch(args.batchSize()));
            }
            case SEARCH_NODES -> store.searchNodes(bind(arguments, ToolArguments.Query.class).query());
            case OPEN_NODES -> store.openNodes(bind(arguments, ToolArguments.Names.class).names());
            case READ_GRAPH -> store.readGraph();
            case GET_ENTITY -> store.getEntity(bind(arguments, ToolArguments.EntityQuery.class).name());
            case GET_ENTITY_AT_TIME -> {
                ToolArguments.EntityQuery args = bind(arguments, ToolArguments.EntityQuery.class);
                yield store.getEntityAtTime(args.name(), args.timestamp());
            }
            case GET_ENTITY_CHANGES -> {
                ToolArguments.EntityQuery args = bind(arguments, ToolArguments.EntityQuery.class);
                yield store.getEntityChanges(args.name(), args.start(), args.end());
            }
            case GET_RELATIONS_AT_TIME -> {
                ToolArguments.EntityQuery args = bind(arguments, ToolArguments.EntityQuery.class);
                Optional<Direction> direction = Direction.parse(args.direction());
                if (direction.isEmpty()) {
                    yield StoreResult.failure(StoreError.invalidArgument("Unknown direction: " + args.direction()));
                }
                yield store.getRelationsAtTime(args.name(), args.timestamp(), direction.get());
            }
            case GET_RELATION_AT_TIME -> {
                ToolArguments.RelationQuery args = bind(arguments, ToolArguments.RelationQuery.class);
                yield store.getRelationAtTime(args.from(), args.to(), args.relationType(), args.timestamp());
            }
            case GET_RELATION_HISTORY -> {
                ToolArguments.RelationQuery args = bind(arguments, ToolArguments.RelationQuery.class);
                yield store.getRelationHistory(args.from(), args.to(), args.relationType(), args.start(), args.end());
            }
            case GET_CHANGES_IN_PERIOD -> {
                ToolArguments.Period args = bind(arguments, ToolArguments.Period.class);
                Optional<ChangeType> changeType = ChangeType.parse(args.changeType());
                if (changeType.isEmpty() && args.changeType() != null && !args.changeType().isBlank()) {
                    yield StoreResult.failure(StoreError.invalidArgument("Unknown change type: " + args.changeType()));
                }
                yield store.getChangesInPeriod(args.start(), args.end(), args.entityType(), changeType.orElse(null));
            }
            case GET_GRAPH_AT_TIME -> store.getGraphAtTime(bind(arguments, ToolArguments.PointInTime.class).timestamp());
            case CREATE_CATEGORY -> {
                ToolArguments.NewCategory args = bind(arguments, ToolArguments.NewCategory.class);
                if (args.priority() == null) {
                    yield StoreResult.failure(StoreError.invalidArgument("priority is required"));
                }
                yield store.createCategory(args.name(), args.priority(), args.retentionDays());
            }
            case LIST_CATEGORIES -> store.listCategories();
            case PARTITION_OF -> store.partitionOf(bind(arguments, ToolArguments.EntityQuery.class).name())
                .map(partition -> partition.map(Partition::wireName).orElse(null));
            case PARTITION_COUNTS -> store.partitionCounts().map(counts -> {
                Map<String, Long> byName = new LinkedHashMap<>();
                counts.forEach((partition, count) -> byName.put(partition.wireName(), count));
                return byName;
            });
            case ENTITY_STATISTICS -> store.entityStatistics();
            case RELATION_SUMMARY -> store.relationSummary();
            case RUN_MAINTENANCE -> store.runMaintenance();
        };
    }

    private <T> T bind(Map<String, Object> arguments, Class<T> type) {
        return mapper.convertValue(arguments, type);
    }

    private int batch(Integer requested) {
        return requested == null ? defaultBatchSize : requested;
    }

    private Object unwrap(Object value) {
        if (value instanceof Optional<?> optional) {
            return optional.orElse(null);
        }
        return value;
    }
}
