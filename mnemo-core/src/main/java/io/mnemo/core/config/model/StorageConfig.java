package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String databaseUrl,
    int poolSize,
    long acquireTimeoutMs,
    int batchSize,
    String journalMode,
    String synchronous,
    int cacheSizeKb,
    int busyTimeoutMs,
    String changedBy
) {

    public static StorageConfig defaults() {
        return new StorageConfig(
            "sqlite://~/.mnemo/memory.db",
            5,
            5_000,
            1_000,
            "WAL",
            "NORMAL",
            20_000,
            5_000,
            "system"
        );
    }

    public StorageConfig withDatabaseUrl(String url) {
        return new StorageConfig(url, poolSize, acquireTimeoutMs, batchSize, journalMode, synchronous, cacheSizeKb, busyTimeoutMs, changedBy);
    }

    public StorageConfig withPool(int size, long timeoutMs) {
        return new StorageConfig(databaseUrl, size, timeoutMs, batchSize, journalMode, synchronous, cacheSizeKb, busyTimeoutMs, changedBy);
    }
}
