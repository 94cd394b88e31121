package io.workline.cli;

import io.workline.core.config.model.WorklineConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Run the metrics endpoint, outbox worker and store purge until stopped")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Metrics port (defaults to server.port from config)")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            WorklineConfig config = context.configService().load(context.configPath());
            return context.serveRunner().run(port != null ? port : config.server().port());
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
