package io.workline.cli;

import io.workline.core.config.model.WorklineConfig;
import io.workline.core.outbox.DeliveryResponse;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "ping", description = "Send a test event to a webhook destination")
public final class PingCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--url"}, description = "Destination URL (defaults to outbox.destinationUrl)")
    String url;

    public PingCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            WorklineConfig config = context.configService().load(context.configPath());
            String target = url != null && !url.isBlank() ? url.trim() : config.outbox().destinationUrl();
            if (target.isBlank()) {
                System.err.println("No destination: pass --url or set outbox.destinationUrl");
                return 1;
            }
            DeliveryResponse response = context.outbox().ping(target);
            System.out.println(target + ": " + response.describe());
            return response.successful() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Ping command failed: " + e.getMessage());
            return 1;
        }
    }
}
