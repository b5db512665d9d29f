package io.mnemo.cli;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.graph.KnowledgeGraphStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath, Clock clock) {
        this(configService, configPath, clock, portOverride -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }

    public KnowledgeGraphStore openStore() throws IOException {
        return KnowledgeGraphStore.open(configService.load(configPath), clock);
    }
}
