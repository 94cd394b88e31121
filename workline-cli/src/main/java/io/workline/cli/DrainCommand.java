package io.workline.cli;

import io.workline.core.config.model.WorklineConfig;
import io.workline.core.outbox.DrainReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "drain", description = "Run one outbox delivery cycle")
public final class DrainCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--batch"}, description = "Maximum entries to attempt (defaults to outbox.batchSize)")
    Integer batch;

    public DrainCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            WorklineConfig config = context.configService().load(context.configPath());
            int size = batch != null ? batch : config.outbox().batchSize();
            int requeued = context.pipeline().redeliverPending();
            DrainReport report = context.outbox().drain(size);
            if (requeued > 0) {
                System.out.println("Re-queued profiles: " + requeued);
            }
            System.out.println("Due: " + report.due());
            System.out.println("Delivered: " + report.delivered());
            System.out.println("Retried: " + report.retried());
            System.out.println("Dead-lettered: " + report.deadLettered());
            System.out.println("Skipped: " + report.skipped());
            System.out.println("Errors: " + report.errors());
            return report.errors() == 0 ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Drain command failed: " + e.getMessage());
            return 1;
        }
    }
}
