package io.mnemo.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.mcp.server.config.McpServerConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerApplication.class);

    private McpServerApplication() {
    }

    public static void main(String[] args) throws IOException {
        Path configPath = ConfigPaths.defaultConfigPath();
        MnemoConfig config = new ConfigService().load(configPath);
        McpServerConfig serverConfig = McpServerConfig.fromEnv();

        KnowledgeGraphStore store = KnowledgeGraphStore.open(config, Clock.systemUTC());
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        store.partitionManager().start(scheduler);

        McpHttpServer server = createServer(serverConfig, store);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            scheduler.shutdownNow();
            store.close();
        }));
        LOG.info("Mnemo MCP server listening on {}:{} (config {})", serverConfig.host(), server.port(), configPath);
    }

    public static McpHttpServer createServer(McpServerConfig serverConfig, KnowledgeGraphStore store) {
        ObjectMapper mapper = createMapper();
        return new McpHttpServer(serverConfig.host(), serverConfig.port(), new ToolRouter(store, mapper), store, mapper);
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
