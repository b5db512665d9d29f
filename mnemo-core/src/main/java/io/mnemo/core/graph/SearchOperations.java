package io.mnemo.core.graph;

import io.mnemo.core.model.Entity;
import io.mnemo.core.model.KnowledgeGraph;
import io.mnemo.core.partition.Partition;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreResult;
import io.mnemo.core.storage.CaseFold;
import io.mnemo.core.storage.ResultCache;
import io.mnemo.core.storage.Sanitizer;
import io.mnemo.core.storage.StorageContext;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class SearchOperations {
    static final String SEARCH_NODES = Partition.unionAll(
        EntityTable.COLUMNS,
        "fold(name) LIKE ?1 ESCAPE '\\' OR fold(entity_type) LIKE ?1 ESCAPE '\\'"
            + " OR EXISTS (SELECT 1 FROM json_each(observations) o WHERE fold(o.value) LIKE ?1 ESCAPE '\\')"
    ) + "\nORDER BY created_at DESC, name";

    private final StorageContext context;
    private final EntityTable entities;
    private final RelationTable relations;

    public SearchOperations(StorageContext context, EntityTable entities, RelationTable relations) {
        this.context = context;
        this.entities = entities;
        this.relations = relations;
    }

    public StoreResult<KnowledgeGraph> searchNodes(String query) {
        String text = Sanitizer.identity(query);
        if (text.isEmpty()) {
            return StoreResult.failure(StoreError.invalidArgument("search query must not be empty"));
        }
        long started = System.nanoTime();
        ResultCache cache = context.resultCache();
        String key = ResultCache.key(SEARCH_NODES, text);
        Optional<KnowledgeGraph> cached = cache.get(key, KnowledgeGraph.class);
        if (cached.isPresent()) {
            context.recordCacheHit("search_nodes", started);
            return StoreResult.ok(cached.get());
        }
        long generation = cache.generation();
        String pattern = Sanitizer.likeContains(CaseFold.apply(text));
        StoreResult<KnowledgeGraph> result = context.read("search_nodes", handle -> {
            PreparedStatement statement = handle.prepare(SEARCH_NODES);
            statement.setString(1, pattern);
            List<Entity> matched = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    matched.add(entities.map(resultSet));
                }
            }
            Set<String> names = new LinkedHashSet<>();
            matched.forEach(entity -> names.add(entity.name()));
            return StoreResult.ok(new KnowledgeGraph(matched, relations.touching(handle, names)));
        });
        if (result.isOk()) {
            cache.putIfCurrent(key, result.value(), generation);
        }
        return result;
    }

    public StoreResult<KnowledgeGraph> openNodes(List<String> names) {
        if (names == null || names.isEmpty()) {
            return StoreResult.ok(KnowledgeGraph.empty());
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String raw : names) {
            String name = Sanitizer.identity(raw);
            if (!name.isEmpty()) {
                wanted.add(name);
            }
        }
        if (wanted.isEmpty()) {
            return StoreResult.ok(KnowledgeGraph.empty());
        }
        return context.read("open_nodes", handle -> {
            List<Entity> found = entities.findAll(handle, wanted).stream().map(LocatedEntity::entity).toList();
            List<String> present = found.stream().map(Entity::name).toList();
            return StoreResult.ok(new KnowledgeGraph(found, relations.among(handle, present)));
        });
    }

    public StoreResult<KnowledgeGraph> readGraph() {
        return context.read("read_graph", handle ->
            StoreResult.ok(new KnowledgeGraph(entities.readAll(handle), relations.readAll(handle))));
    }
}
