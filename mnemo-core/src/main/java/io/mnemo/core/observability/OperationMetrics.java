package io.mnemo.core.observability;

public record OperationMetrics(
    String operation,
    int count,
    int failures,
    double averageMillis,
    double cacheHitRate,
    double p95Millis,
    double p99Millis
) {
}
