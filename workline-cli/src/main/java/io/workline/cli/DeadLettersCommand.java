package io.workline.cli;

import io.workline.core.outbox.OutboxEntry;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "dead-letters", description = "List dead-lettered deliveries or requeue one")
public final class DeadLettersCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--requeue"}, description = "Event id to move back to the pending queue")
    String requeue;

    public DeadLettersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (requeue != null && !requeue.isBlank()) {
                if (!context.outbox().requeueDead(requeue.trim())) {
                    System.err.println("No dead letter with id " + requeue.trim());
                    return 1;
                }
                System.out.println("Requeued " + requeue.trim());
                return 0;
            }

            List<OutboxEntry> dead = context.outbox().deadLetters();
            if (dead.isEmpty()) {
                System.out.println("No dead letters");
                return 0;
            }
            for (OutboxEntry entry : dead) {
                System.out.println(entry.eventId() + " call=" + entry.callId() + " attempts=" + entry.attempts()
                    + " status=" + entry.lastStatusCode() + " destination=" + entry.destinationUrl()
                    + " error=" + entry.lastError());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Dead-letters command failed: " + e.getMessage());
            return 1;
        }
    }
}
