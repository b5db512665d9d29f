package io.mnemo.core.graph;

import io.mnemo.core.model.Entity;
import io.mnemo.core.model.Relation;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.storage.Sanitizer;
import java.util.Optional;

final class Validator {

    private Validator() {
    }

    static Optional<StoreError> entity(Entity entity) {
        if (entity == null) {
            return Optional.of(StoreError.invalidArgument("entity must not be null"));
        }
        if (entity.name() == null || entity.name().isEmpty()) {
            return Optional.of(StoreError.invalidArgument("entity name must not be empty"));
        }
        if (Sanitizer.identity(entity.entityType()).isEmpty()) {
            return Optional.of(StoreError.invalidArgument("entityType must not be empty for " + entity.name()));
        }
        return score(entity.confidenceScore(), entity.name());
    }

    static Optional<StoreError> relation(Relation relation) {
        if (relation == null) {
            return Optional.of(StoreError.invalidArgument("relation must not be null"));
        }
        if (isEmpty(relation.from()) || isEmpty(relation.to())) {
            return Optional.of(StoreError.invalidArgument("relation endpoints must not be empty"));
        }
        if (Sanitizer.identity(relation.relationType()).isEmpty()) {
            return Optional.of(StoreError.invalidArgument("relationType must not be empty"));
        }
        if (relation.validFrom() != null && relation.validUntil() != null
            && !relation.validFrom().isBefore(relation.validUntil())) {
            return Optional.of(StoreError.invalidArgument("validFrom must be before validUntil"));
        }
        return score(relation.confidenceScore(), relation.from() + " -> " + relation.to());
    }

    static Optional<StoreError> name(String name) {
        if (isEmpty(name)) {
            return Optional.of(StoreError.invalidArgument("entity name must not be empty"));
        }
        return Optional.empty();
    }

    private static Optional<StoreError> score(Double score, String subject) {
        if (score == null || score.isNaN()) {
            return Optional.of(StoreError.invalidArgument("confidenceScore must be a number in [0, 1] for " + subject));
        }
        return Optional.empty();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
