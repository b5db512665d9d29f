package io.mnemo.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.graph.KnowledgeGraphStore;
import io.mnemo.core.model.Entity;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MnemoCliCommandTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path configPath;

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "storage": { "databaseUrl": "sqlite://%s" }
            }
            """.formatted(tempDir.resolve("memory.db").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
    }

    @Test
    void shouldReportStatusOfConfiguredStore() throws Exception {
        CliContext context = new CliContext(new ConfigService(), configPath, CLOCK);
        try (KnowledgeGraphStore store = context.openStore()) {
            store.createEntities(List.of(Entity.of("alice", "person", List.of()))).orElseThrow();
        }

        Execution status = execute(context, "status");

        assertThat(status.code()).isEqualTo(0);
        assertThat(status.out()).contains("Status: ok", "Partition recent: 1", "Partition archive: 0");
    }

    @Test
    void shouldRunMaintenancePass() throws Exception {
        CliContext context = new CliContext(new ConfigService(), configPath, CLOCK);
        try (KnowledgeGraphStore store = context.openStore()) {
            Entity old = new Entity("fossil", "memory", List.of(), null, null, null,
                CLOCK.instant().minus(Duration.ofDays(45)), null, null);
            store.createEntities(List.of(old)).orElseThrow();
        }

        Execution maintain = execute(context, "maintain");

        assertThat(maintain.code()).isEqualTo(0);
        assertThat(maintain.out()).contains("Entity types summarized: 1");
        Execution status = execute(context, "status");
        assertThat(status.out()).contains("Partition intermediate: 1", "Type memory: 1 entities");
    }

    @Test
    void shouldWriteDefaultsOnInit() throws Exception {
        Path fresh = tempDir.resolve("fresh/config.json");
        CliContext context = new CliContext(new ConfigService(), fresh, CLOCK);

        Execution init = execute(context, "init");

        assertThat(init.code()).isEqualTo(0);
        assertThat(init.out()).contains("Created config");
        assertThat(Files.readString(fresh)).contains("\"archiveAfterDays\" : 180");
    }

    @Test
    void shouldDelegateServeToRunner() {
        AtomicReference<Integer> requestedPort = new AtomicReference<>();
        CliContext context = new CliContext(new ConfigService(), configPath, CLOCK, port -> {
            requestedPort.set(port);
            return 0;
        });

        Execution serve = execute(context, "serve", "--port", "9100");

        assertThat(serve.code()).isEqualTo(0);
        assertThat(requestedPort.get()).isEqualTo(9100);
    }

    private Execution execute(CliContext context, String... args) {
        CommandLine commandLine = new CommandLine(new MnemoCliCommand());
        commandLine.addSubcommand(new InitCommand(context));
        commandLine.addSubcommand(new StatusCommand(context));
        commandLine.addSubcommand(new MaintainCommand(context));
        commandLine.addSubcommand(new ServeCommand(context));

        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            code = commandLine.execute(args);
        } finally {
            System.setOut(originalOut);
        }
        return new Execution(code, out.toString(StandardCharsets.UTF_8));
    }

    private record Execution(int code, String out) {
    }
}
