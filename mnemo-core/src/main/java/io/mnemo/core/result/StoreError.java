package io.mnemo.core.result;

import java.util.Objects;

public record StoreError(ErrorKind kind, String message) {

    public StoreError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public static StoreError entityNotFound(String name) {
        return new StoreError(ErrorKind.ENTITY_NOT_FOUND, "Entity not found: " + name);
    }

    public static StoreError entityAlreadyExists(String name) {
        return new StoreError(ErrorKind.ENTITY_ALREADY_EXISTS, "Entity already exists: " + name);
    }

    public static StoreError invalidArgument(String message) {
        return new StoreError(ErrorKind.INVALID_ARGUMENT, message);
    }

    @Override
    public String toString() {
        return kind.wireName() + ": " + message;
    }
}
