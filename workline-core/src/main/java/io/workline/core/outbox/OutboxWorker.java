package io.workline.core.outbox;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the outbox on a fixed interval. {@link #close()} stops scheduling new drains and waits
 * for the one in flight to finish.
 */
public final class OutboxWorker implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(OutboxWorker.class);

    private final DeliveryOutbox outbox;
    private final int batchSize;
    private final Duration interval;
    private final Duration shutdownGrace;
    private final ScheduledExecutorService scheduler;

    public OutboxWorker(DeliveryOutbox outbox, int batchSize, Duration interval) {
        this(outbox, batchSize, interval, Duration.ofSeconds(60));
    }

    public OutboxWorker(DeliveryOutbox outbox, int batchSize, Duration interval, Duration shutdownGrace) {
        this.outbox = Objects.requireNonNull(outbox, "outbox must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.batchSize = batchSize;
        this.interval = interval;
        this.shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(60) : shutdownGrace;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workline-outbox");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Outbox worker started: batch {} every {}", batchSize, interval);
    }

    /**
     * One drain cycle. Failures are logged so the schedule keeps running.
     */
    void runOnce() {
        try {
            outbox.drain(batchSize);
        } catch (Exception e) {
            LOG.error("Outbox drain failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Outbox worker did not stop within {}; interrupting", shutdownGrace);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Outbox worker stopped");
    }
}
