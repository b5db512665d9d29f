package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    StorageConfig storage,
    CacheConfig cache,
    PartitionConfig partitions
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            StorageConfig.defaults(),
            CacheConfig.defaults(),
            PartitionConfig.defaults()
        );
    }

    public MnemoConfig withStorage(StorageConfig updated) {
        return new MnemoConfig(updated, cache, partitions);
    }
}
