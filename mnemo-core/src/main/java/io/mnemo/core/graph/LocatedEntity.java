package io.mnemo.core.graph;

import io.mnemo.core.model.Entity;
import io.mnemo.core.partition.Partition;

public record LocatedEntity(Entity entity, Partition partition) {
}
