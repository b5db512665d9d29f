package io.mnemo.cli;

import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "init", description = "Write the configuration file, filling in defaults")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean existed = Files.exists(context.configPath());
            MnemoConfig config = overwrite ? MnemoConfig.defaults() : context.configService().load(context.configPath());
            context.configService().save(context.configPath(), config);
            if (!existed) {
                System.out.println("Created config: " + context.configPath());
            } else if (overwrite) {
                System.out.println("Overwrote config with defaults: " + context.configPath());
            } else {
                System.out.println("Refreshed config with new defaults: " + context.configPath());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
