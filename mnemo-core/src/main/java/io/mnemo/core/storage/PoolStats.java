package io.mnemo.core.storage;

public record PoolStats(
    int maxSize,
    int active,
    int available,
    int idle,
    int peakActive,
    long handlesCreated,
    long acquireTimeouts
) {
}
