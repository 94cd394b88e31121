package io.workline.cli;

import io.workline.core.config.ConfigPaths;
import io.workline.core.config.model.StoreConfig;
import io.workline.core.config.model.WorklineConfig;
import io.workline.core.outbox.OutboxStats;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and outbox status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            WorklineConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Store backend: " + config.store().backend());
            if (StoreConfig.SQLITE.equals(config.store().backend())) {
                System.out.println("SQLite path: " + ConfigPaths.expandHome(config.store().sqlitePath()));
            }
            System.out.println("Provider: " + config.provider().name() + " (configured: " + config.provider().configured() + ")");
            System.out.println("Fallback provider: " + config.fallbackProvider().name()
                + " (configured: " + config.fallbackProvider().configured() + ")");
            System.out.println("Model: " + config.conversation().model());
            System.out.println("Default destination: "
                + (config.outbox().destinationUrl().isBlank() ? "(none)" : config.outbox().destinationUrl()));

            System.out.println("Active calls: " + context.pipeline().activeCalls().size());

            OutboxStats stats = context.outbox().stats();
            System.out.println("Outbox pending: " + stats.pending() + " (due now: " + stats.due() + ")");
            System.out.println("Outbox dead letters: " + stats.dead());
            stats.retryDistribution().forEach((retries, count) ->
                System.out.println("  retry " + retries + ": " + count));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
