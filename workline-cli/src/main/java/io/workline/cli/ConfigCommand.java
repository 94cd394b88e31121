package io.workline.cli;

import io.workline.core.config.model.WorklineConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "config", description = "Print the effective configuration or write a default config file")
public final class ConfigCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--init", description = "Write a default config file if none exists")
    boolean init;

    @Option(names = "--overwrite", description = "With --init, replace an existing config file")
    boolean overwrite;

    public ConfigCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (init) {
                boolean exists = Files.exists(context.configPath());
                if (exists && !overwrite) {
                    System.out.println("Config already exists: " + context.configPath());
                    return 0;
                }
                context.configService().save(context.configPath(), WorklineConfig.defaults());
                System.out.println((exists ? "Overwrote config with defaults: " : "Created config: ") + context.configPath());
                return 0;
            }
            WorklineConfig config = context.configService().load(context.configPath());
            System.out.println(context.configService().toPrettyJson(config));
            return 0;
        } catch (Exception e) {
            System.err.println("Config command failed: " + e.getMessage());
            return 1;
        }
    }
}
