package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheConfig(
    int statementCapacity,
    int resultCapacity,
    long resultTtlSeconds,
    long cleanupIntervalSeconds,
    double resultTargetRatio
) {

    public static CacheConfig defaults() {
        return new CacheConfig(100, 1_000, 300, 60, 0.9);
    }
}
