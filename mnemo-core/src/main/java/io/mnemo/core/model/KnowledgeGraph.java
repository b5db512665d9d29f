package io.mnemo.core.model;

import java.util.List;

public record KnowledgeGraph(List<Entity> entities, List<Relation> relations) {

    public KnowledgeGraph {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    public static KnowledgeGraph empty() {
        return new KnowledgeGraph(List.of(), List.of());
    }
}
