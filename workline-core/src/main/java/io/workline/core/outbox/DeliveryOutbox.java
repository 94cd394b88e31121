package io.workline.core.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.workline.core.observability.PipelineMetrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * At-least-once webhook delivery. An entry is removed only after a 2xx response; failures are
 * rescheduled with exponential backoff until they run out of retries and move to the dead
 * letters, where an operator can inspect or requeue them.
 */
public final class DeliveryOutbox implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryOutbox.class);

    public static final String EVENT_PROFILE_COMPLETED = "worker_profile_completed";
    public static final String EVENT_TEST = "webhook_test";
    static final String USER_AGENT = "Workline-Outbox/1.0";

    private final OutboxStore store;
    private final WebhookTransport transport;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final PipelineMetrics metrics;
    private final ExecutorService pool;
    private final String owner;
    private final ObjectMapper mapper;

    public DeliveryOutbox(OutboxStore store, WebhookTransport transport, BackoffPolicy backoff, int workerThreads, Clock clock) {
        this(store, transport, backoff, workerThreads, clock, null);
    }

    public DeliveryOutbox(
        OutboxStore store,
        WebhookTransport transport,
        BackoffPolicy backoff,
        int workerThreads,
        Clock clock,
        PipelineMetrics metrics
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = metrics;
        this.pool = Executors.newFixedThreadPool(Math.max(1, workerThreads));
        this.owner = UUID.randomUUID().toString();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public String enqueue(String callId, String callerIdentityHash, String destinationUrl, Map<String, Object> payload)
        throws IOException {
        Objects.requireNonNull(callId, "callId must not be null");
        if (destinationUrl == null || destinationUrl.isBlank()) {
            throw new IllegalArgumentException("destinationUrl must not be blank");
        }
        String eventId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        OutboxEntry entry = OutboxEntry.pending(eventId, callId, callerIdentityHash, destinationUrl, payload, clock.instant());
        store.save(entry);
        LOG.info("Queued event {} for call {}", eventId, callId);
        return eventId;
    }

    /**
     * Delivers up to {@code batchSize} due entries in parallel. Safe to run concurrently with
     * itself: each entry is leased before delivery and re-read under the lease.
     */
    public DrainReport drain(int batchSize) throws IOException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        Instant now = clock.instant();
        List<OutboxEntry> due = store.pending().stream()
            .filter(entry -> entry.dueAt(now))
            .limit(batchSize)
            .toList();
        if (due.isEmpty()) {
            return DrainReport.empty();
        }

        List<Future<Optional<DeliveryOutcome>>> futures = new ArrayList<>();
        for (OutboxEntry entry : due) {
            futures.add(pool.submit(() -> process(entry.eventId())));
        }

        int delivered = 0;
        int retried = 0;
        int dead = 0;
        int skipped = 0;
        int errors = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                Optional<DeliveryOutcome> outcome = futures.get(i).get();
                if (outcome.isEmpty()) {
                    skipped++;
                    continue;
                }
                switch (outcome.get()) {
                    case SUCCESS -> delivered++;
                    case RETRY -> retried++;
                    case DEAD_LETTER -> dead++;
                }
            } catch (ExecutionException e) {
                errors++;
                LOG.error("Delivery of event {} crashed", due.get(i).eventId(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while draining outbox", e);
            }
        }
        DrainReport report = new DrainReport(due.size(), delivered, retried, dead, skipped, errors);
        LOG.info("Outbox drain finished: {}", report);
        return report;
    }

    public List<OutboxEntry> pending() throws IOException {
        return store.pending();
    }

    public List<OutboxEntry> deadLetters() throws IOException {
        return store.dead();
    }

    /**
     * Moves a dead letter back to pending with a fresh retry budget, due immediately.
     */
    public boolean requeueDead(String eventId) throws IOException {
        Optional<OutboxEntry> dead = store.getDead(eventId);
        if (dead.isEmpty()) {
            return false;
        }
        store.resurrect(dead.get().requeued(clock.instant()));
        LOG.info("Requeued dead letter {}", eventId);
        return true;
    }

    public OutboxStats stats() throws IOException {
        Instant now = clock.instant();
        List<OutboxEntry> pending = store.pending();
        Map<Integer, Integer> retries = new LinkedHashMap<>();
        int due = 0;
        for (OutboxEntry entry : pending) {
            retries.merge(entry.retryCount(), 1, Integer::sum);
            if (entry.dueAt(now)) {
                due++;
            }
        }
        return new OutboxStats(pending.size(), due, store.dead().size(), retries);
    }

    /**
     * Sends a test event straight to {@code url}. Nothing is queued and nothing is retried.
     */
    public DeliveryResponse ping(String url) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventType", EVENT_TEST);
        body.put("timestamp", clock.instant().toString());
        body.put("message", "Test delivery from Workline");
        try {
            return transport.send(new DeliveryRequest(url, headers(EVENT_TEST, "test_" + UUID.randomUUID(), ""), mapper.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            return DeliveryResponse.failure("Failed to encode test event: " + e.getOriginalMessage(), null);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Optional<DeliveryOutcome> process(String eventId) throws IOException {
        if (!store.tryLease(eventId, owner)) {
            LOG.debug("Event {} is leased by another drain", eventId);
            return Optional.empty();
        }
        try {
            Optional<OutboxEntry> current = store.get(eventId);
            if (current.isEmpty() || !current.get().dueAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(deliver(current.get()));
        } finally {
            store.release(eventId);
        }
    }

    private DeliveryOutcome deliver(OutboxEntry entry) throws IOException {
        DeliveryResponse response;
        try {
            response = transport.send(request(entry));
        } catch (RuntimeException e) {
            LOG.error("Transport crashed delivering event {}", entry.eventId(), e);
            response = DeliveryResponse.failure("Transport error: " + e.getMessage(), null);
        }
        if (response.successful()) {
            store.delete(entry.eventId());
            record(DeliveryOutcome.SUCCESS, response);
            LOG.info("Delivered event {} for call {} with HTTP {}", entry.eventId(), entry.callId(), response.statusCode());
            return DeliveryOutcome.SUCCESS;
        }

        Instant now = clock.instant();
        int retryCount = entry.retryCount() + 1;
        String error = response.error().isBlank() ? response.describe() + " " + response.body() : response.error();
        OutboxEntry failed = entry.failed(response.statusCode(), error.trim(), now.plus(backoff.delayFor(retryCount)));
        if (backoff.exhausted(failed.retryCount())) {
            store.bury(failed);
            record(DeliveryOutcome.DEAD_LETTER, response);
            LOG.error("Event {} for call {} dead-lettered after {} attempts: {}",
                entry.eventId(), entry.callId(), failed.attempts(), response.describe());
            return DeliveryOutcome.DEAD_LETTER;
        }
        store.save(failed);
        record(DeliveryOutcome.RETRY, response);
        LOG.warn("Delivery of event {} failed ({}); retry {} at {}",
            entry.eventId(), response.describe(), failed.retryCount(), failed.nextRetryAt());
        return DeliveryOutcome.RETRY;
    }

    private DeliveryRequest request(OutboxEntry entry) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventType", EVENT_PROFILE_COMPLETED);
        body.put("eventId", entry.eventId());
        body.put("callId", entry.callId());
        body.put("timestamp", clock.instant().toString());
        body.put("profile", entry.payload());
        return new DeliveryRequest(
            entry.destinationUrl(),
            headers(EVENT_PROFILE_COMPLETED, entry.eventId(), entry.callId()),
            mapper.writeValueAsString(body)
        );
    }

    private static Map<String, String> headers(String eventType, String eventId, String callId) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", USER_AGENT);
        headers.put("X-Event-Type", eventType);
        headers.put("X-Event-ID", eventId);
        headers.put("Idempotency-Key", eventId);
        if (!callId.isBlank()) {
            headers.put("X-Call-ID", callId);
        }
        return headers;
    }

    private void record(DeliveryOutcome outcome, DeliveryResponse response) {
        if (metrics != null) {
            metrics.delivery(outcome, response.latency());
        }
    }
}
