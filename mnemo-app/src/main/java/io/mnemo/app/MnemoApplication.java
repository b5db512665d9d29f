package io.mnemo.app;

import io.mnemo.cli.CliContext;
import io.mnemo.cli.InitCommand;
import io.mnemo.cli.MaintainCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.ServeCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.mcp.server.McpHttpServer;
import io.mnemo.mcp.server.McpServerApplication;
import io.mnemo.mcp.server.config.McpServerConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MnemoApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MnemoApplication.class);

    private MnemoApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Clock clock = Clock.systemUTC();

        CliContext context = new CliContext(
            configService,
            configPath,
            clock,
            portOverride -> runServer(configService, configPath, clock, portOverride)
        );

        int exitCode = commandLine(context).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("maintain", new MaintainCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));
        return commandLine;
    }

    private static int runServer(ConfigService configService, Path configPath, Clock clock, Integer portOverride) throws Exception {
        MnemoConfig config = configService.load(configPath);
        McpServerConfig serverConfig = McpServerConfig.fromEnv();
        if (portOverride != null) {
            serverConfig = serverConfig.withPort(portOverride);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try (KnowledgeGraphStore store = KnowledgeGraphStore.open(config, clock)) {
            McpHttpServer server = McpServerApplication.createServer(serverConfig, store);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            store.partitionManager().start(scheduler);
            try {
                LOG.info("Serving {} from {}", store.health().databasePath(), configPath);
                System.out.println("Server started on http://127.0.0.1:" + server.port());
                System.out.println("Endpoints: GET /healthz, GET /metrics, GET /mcp/tools, POST /mcp/call");
                shutdown.await();
            } finally {
                server.stop();
            }
        } finally {
            scheduler.shutdownNow();
        }
        return 0;
    }
}
