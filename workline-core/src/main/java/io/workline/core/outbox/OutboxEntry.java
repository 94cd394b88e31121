package io.workline.core.outbox;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record OutboxEntry(
    String eventId,
    String callId,
    String callerIdentityHash,
    String destinationUrl,
    Map<String, Object> payload,
    Instant createdAt,
    int retryCount,
    int attempts,
    Instant nextRetryAt,
    OutboxState state,
    int lastStatusCode,
    String lastError
) {
    public OutboxEntry {
        eventId = eventId == null ? "" : eventId.trim();
        callId = callId == null ? "" : callId.trim();
        callerIdentityHash = callerIdentityHash == null ? "" : callerIdentityHash.trim();
        destinationUrl = destinationUrl == null ? "" : destinationUrl.trim();
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        retryCount = Math.max(0, retryCount);
        attempts = Math.max(0, attempts);
        nextRetryAt = nextRetryAt == null ? createdAt : nextRetryAt;
        state = state == null ? OutboxState.PENDING : state;
        lastError = lastError == null ? "" : lastError;
    }

    public static OutboxEntry pending(
        String eventId,
        String callId,
        String callerIdentityHash,
        String destinationUrl,
        Map<String, Object> payload,
        Instant now
    ) {
        return new OutboxEntry(eventId, callId, callerIdentityHash, destinationUrl, payload, now, 0, 0, now,
            OutboxState.PENDING, 0, "");
    }

    public boolean dueAt(Instant now) {
        return state == OutboxState.PENDING && !nextRetryAt.isAfter(now);
    }

    public OutboxEntry failed(int statusCode, String error, Instant nextRetry) {
        return new OutboxEntry(eventId, callId, callerIdentityHash, destinationUrl, payload, createdAt,
            retryCount + 1, attempts + 1, nextRetry, state, statusCode, error);
    }

    public OutboxEntry dead() {
        return new OutboxEntry(eventId, callId, callerIdentityHash, destinationUrl, payload, createdAt,
            retryCount, attempts, nextRetryAt, OutboxState.DEAD, lastStatusCode, lastError);
    }

    public OutboxEntry requeued(Instant now) {
        return new OutboxEntry(eventId, callId, callerIdentityHash, destinationUrl, payload, createdAt,
            0, attempts, now, OutboxState.PENDING, lastStatusCode, lastError);
    }
}
