package io.workline.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.workline.core.store.KeyValueStore;
import io.workline.core.store.StoreKeys;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative call state. Every write re-serializes the whole session under a fresh expiry,
 * never later than {@code createdAt + maxLifetime}.
 */
public final class SessionStore {
    private static final Logger LOG = LoggerFactory.getLogger(SessionStore.class);

    private final KeyValueStore store;
    private final Duration ttl;
    private final Duration maxLifetime;
    private final Clock clock;
    private final ObjectMapper mapper;

    public SessionStore(KeyValueStore store, Duration ttl, Duration maxLifetime, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ttl = requirePositive(ttl, "ttl");
        this.maxLifetime = requirePositive(maxLifetime, "maxLifetime");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public CallSession create(String callId, String callerIdentityHash, String destinationUrl, SessionPatch initial)
        throws IOException {
        Instant now = clock.instant();
        CallSession session = validate(CallSession.queued(callId, callerIdentityHash, destinationUrl, now)
            .apply(initial), now);
        if (!store.putIfAbsent(StoreKeys.callSession(callId), mapper.writeValueAsString(session), ttl)) {
            throw new IllegalStateException("Call session already exists: " + callId);
        }
        LOG.info("Created call session {} for caller {}", session.callId(), session.callerIdentityHash());
        return session;
    }

    public Optional<CallSession> get(String callId) throws IOException {
        Optional<String> json = store.get(StoreKeys.callSession(callId));
        if (json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(json.get(), CallSession.class));
    }

    /**
     * Applies a patch to a live session. Returns false when the session is unknown, expired or
     * past its maximum lifetime; never creates one.
     */
    public boolean update(String callId, SessionPatch patch) throws IOException {
        Optional<CallSession> current = get(callId);
        if (current.isEmpty()) {
            LOG.warn("Call session {} not found for update", callId);
            return false;
        }
        Instant now = clock.instant();
        CallSession updated = validate(current.get().apply(patch), now);
        Instant ceiling = updated.createdAt().plus(maxLifetime);
        Instant expiry = now.plus(ttl).isBefore(ceiling) ? now.plus(ttl) : ceiling;
        if (!expiry.isAfter(now)) {
            LOG.warn("Call session {} exceeded its maximum lifetime; dropping", callId);
            store.delete(StoreKeys.callSession(callId));
            return false;
        }
        boolean written = store.replace(
            StoreKeys.callSession(callId),
            mapper.writeValueAsString(updated),
            Duration.between(now, expiry)
        );
        if (!written) {
            LOG.warn("Call session {} expired during update", callId);
        }
        return written;
    }

    public boolean delete(String callId) throws IOException {
        boolean deleted = store.delete(StoreKeys.callSession(callId));
        if (deleted) {
            LOG.info("Deleted call session {}", callId);
        }
        return deleted;
    }

    public List<CallSession> listActive() throws IOException {
        List<CallSession> active = new ArrayList<>();
        for (String key : store.keys(StoreKeys.CALL_SESSION)) {
            Optional<CallSession> session = get(StoreKeys.idOf(key, StoreKeys.CALL_SESSION));
            if (session.isPresent() && session.get().status() == CallStatus.ACTIVE) {
                active.add(session.get());
            }
        }
        return active;
    }

    /**
     * Completed sessions whose profile still has to be queued for delivery.
     */
    public List<CallSession> listPendingDelivery() throws IOException {
        List<CallSession> pending = new ArrayList<>();
        for (String key : store.keys(StoreKeys.CALL_SESSION)) {
            Optional<CallSession> session = get(StoreKeys.idOf(key, StoreKeys.CALL_SESSION));
            if (session.isPresent() && session.get().status() == CallStatus.COMPLETED && session.get().deliveryPending()) {
                pending.add(session.get());
            }
        }
        return pending;
    }

    private CallSession validate(CallSession session, Instant now) {
        if (!session.status().terminal()) {
            return session;
        }
        if (session.status() == CallStatus.COMPLETED
            && !session.conversationState().complete()
            && session.conversationState().terminationReason().isBlank()
            && session.failureReason().isBlank()) {
            throw new IllegalArgumentException(
                "Completed call " + session.callId() + " needs a completed conversation or a termination reason"
            );
        }
        if (session.completedAt() != null) {
            return session;
        }
        return session.apply(SessionPatch.empty().withCompletedAt(now));
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
