package io.workline.core.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.workline.core.store.KeyValueStore;
import io.workline.core.store.StoreKeys;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending entries live under {@code OUTBOX:}, dead letters under {@code OUTBOX_DEAD:} and
 * drain leases under {@code OUTBOX_LEASE:}, all with their own expiry.
 */
public final class OutboxStore {
    private final KeyValueStore store;
    private final Duration entryTtl;
    private final Duration deadLetterTtl;
    private final Duration leaseTtl;
    private final ObjectMapper mapper;

    public OutboxStore(KeyValueStore store, Duration entryTtl, Duration deadLetterTtl, Duration leaseTtl) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.entryTtl = requirePositive(entryTtl, "entryTtl");
        this.deadLetterTtl = requirePositive(deadLetterTtl, "deadLetterTtl");
        this.leaseTtl = requirePositive(leaseTtl, "leaseTtl");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public void save(OutboxEntry entry) throws IOException {
        store.put(StoreKeys.outbox(entry.eventId()), mapper.writeValueAsString(entry), entryTtl);
    }

    public Optional<OutboxEntry> get(String eventId) throws IOException {
        return read(StoreKeys.outbox(eventId));
    }

    public boolean delete(String eventId) throws IOException {
        return store.delete(StoreKeys.outbox(eventId));
    }

    public List<OutboxEntry> pending() throws IOException {
        return list(StoreKeys.OUTBOX);
    }

    /**
     * The dead copy is written before the pending one is removed, so a crash in between leaves
     * the entry visible in both places rather than in neither.
     */
    public void bury(OutboxEntry entry) throws IOException {
        OutboxEntry dead = entry.dead();
        store.put(StoreKeys.deadLetter(dead.eventId()), mapper.writeValueAsString(dead), deadLetterTtl);
        store.delete(StoreKeys.outbox(dead.eventId()));
    }

    public Optional<OutboxEntry> getDead(String eventId) throws IOException {
        return read(StoreKeys.deadLetter(eventId));
    }

    public List<OutboxEntry> dead() throws IOException {
        return list(StoreKeys.OUTBOX_DEAD);
    }

    public void resurrect(OutboxEntry requeued) throws IOException {
        save(requeued);
        store.delete(StoreKeys.deadLetter(requeued.eventId()));
    }

    public boolean tryLease(String eventId, String owner) throws IOException {
        return store.putIfAbsent(StoreKeys.lease(eventId), owner, leaseTtl);
    }

    public void release(String eventId) throws IOException {
        store.delete(StoreKeys.lease(eventId));
    }

    private Optional<OutboxEntry> read(String key) throws IOException {
        Optional<String> json = store.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(json.get(), OutboxEntry.class));
    }

    private List<OutboxEntry> list(String prefix) throws IOException {
        List<OutboxEntry> entries = new ArrayList<>();
        for (String key : store.keys(prefix)) {
            read(key).ifPresent(entries::add);
        }
        entries.sort(Comparator.comparing(OutboxEntry::nextRetryAt).thenComparing(OutboxEntry::eventId));
        return entries;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
