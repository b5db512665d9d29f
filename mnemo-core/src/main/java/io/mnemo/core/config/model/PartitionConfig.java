package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PartitionConfig(
    int recentDays,
    int archiveAfterDays,
    long maintenanceIntervalSeconds,
    long maintenanceRetryDelaySeconds
) {

    public static PartitionConfig defaults() {
        return new PartitionConfig(30, 180, 3_600, 60);
    }
}
