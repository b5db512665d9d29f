package io.mnemo.core.result;

public enum ErrorKind {
    ENTITY_NOT_FOUND("entity_not_found"),
    ENTITY_ALREADY_EXISTS("entity_already_exists"),
    INVALID_ARGUMENT("invalid_argument"),
    POOL_EXHAUSTED("pool_exhausted"),
    STORAGE_FAILURE("storage_failure");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
