package io.workline.core.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for development and tests. Per-key atomicity comes from
 * {@link ConcurrentHashMap#compute}.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        entries.put(requireKey(key), new Entry(value, expiry(ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(requireKey(key));
        return live(entry) ? Optional.of(entry.value()) : Optional.empty();
    }

    @Override
    public boolean replace(String key, String value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        long expiresAt = expiry(ttl);
        AtomicBoolean replaced = new AtomicBoolean(false);
        entries.computeIfPresent(requireKey(key), (k, existing) -> {
            if (!live(existing)) {
                return null;
            }
            replaced.set(true);
            return new Entry(value, expiresAt);
        });
        return replaced.get();
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        long expiresAt = expiry(ttl);
        AtomicBoolean claimed = new AtomicBoolean(false);
        entries.compute(requireKey(key), (k, existing) -> {
            if (live(existing)) {
                return existing;
            }
            claimed.set(true);
            return new Entry(value, expiresAt);
        });
        return claimed.get();
    }

    @Override
    public boolean delete(String key) {
        Entry removed = entries.remove(requireKey(key));
        return live(removed);
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        long expiresAt = expiry(ttlOnCreate);
        AtomicLong result = new AtomicLong();
        entries.compute(requireKey(key), (k, existing) -> {
            if (!live(existing)) {
                result.set(1);
                return new Entry("1", expiresAt);
            }
            long next = Long.parseLong(existing.value()) + 1;
            result.set(next);
            return new Entry(Long.toString(next), existing.expiresAtMs());
        });
        return result.get();
    }

    @Override
    public Optional<Instant> expiresAt(String key) {
        Entry entry = entries.get(requireKey(key));
        return live(entry) ? Optional.of(Instant.ofEpochMilli(entry.expiresAtMs())) : Optional.empty();
    }

    @Override
    public List<String> keys(String prefix) {
        String safePrefix = prefix == null ? "" : prefix;
        return entries.entrySet().stream()
            .filter(e -> e.getKey().startsWith(safePrefix))
            .filter(e -> live(e.getValue()))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.expiresAtMs() <= now);
        return Math.max(0, before - entries.size());
    }

    private boolean live(Entry entry) {
        return entry != null && entry.expiresAtMs() > clock.millis();
    }

    private long expiry(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return clock.millis() + ttl.toMillis();
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return key;
    }

    private record Entry(String value, long expiresAtMs) {
    }
}
