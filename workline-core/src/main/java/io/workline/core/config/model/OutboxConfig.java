package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.workline.core.outbox.BackoffPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OutboxConfig(
    int maxRetries,
    long initialDelaySeconds,
    double backoffMultiplier,
    long maxDelaySeconds,
    int batchSize,
    long drainIntervalSeconds,
    long requestTimeoutSeconds,
    long entryTtlSeconds,
    long deadLetterTtlSeconds,
    long leaseSeconds,
    int workerThreads,
    String destinationUrl
) {
    public OutboxConfig {
        batchSize = batchSize <= 0 ? 10 : batchSize;
        drainIntervalSeconds = drainIntervalSeconds <= 0 ? 30 : drainIntervalSeconds;
        requestTimeoutSeconds = requestTimeoutSeconds <= 0 ? 30 : requestTimeoutSeconds;
        entryTtlSeconds = entryTtlSeconds <= 0 ? 604_800 : entryTtlSeconds;
        deadLetterTtlSeconds = deadLetterTtlSeconds <= 0 ? 2_592_000 : deadLetterTtlSeconds;
        leaseSeconds = leaseSeconds <= 0 ? 120 : leaseSeconds;
        workerThreads = workerThreads <= 0 ? 4 : workerThreads;
        destinationUrl = destinationUrl == null ? "" : destinationUrl.trim();
    }

    public static OutboxConfig defaults() {
        return new OutboxConfig(5, 60, 2.0, 3_600, 10, 30, 30, 604_800, 2_592_000, 120, 4, "");
    }

    public BackoffPolicy backoff() {
        return new BackoffPolicy(
            Duration.ofSeconds(initialDelaySeconds),
            backoffMultiplier,
            Duration.ofSeconds(maxDelaySeconds),
            maxRetries
        );
    }
}
