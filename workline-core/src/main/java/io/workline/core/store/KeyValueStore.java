package io.workline.core.store;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * String key/value store with per-key expiry. Expired keys are invisible to every read,
 * whether or not {@link #purgeExpired()} has reclaimed them yet.
 */
public interface KeyValueStore {
    void put(String key, String value, Duration ttl) throws IOException;

    Optional<String> get(String key) throws IOException;

    /**
     * Overwrites a live key. Returns false without writing when the key is absent or expired.
     */
    boolean replace(String key, String value, Duration ttl) throws IOException;

    boolean putIfAbsent(String key, String value, Duration ttl) throws IOException;

    boolean delete(String key) throws IOException;

    /**
     * Atomically increments a counter. The expiry is set only when the counter is created,
     * so later increments never move the window boundary.
     */
    long increment(String key, Duration ttlOnCreate) throws IOException;

    Optional<Instant> expiresAt(String key) throws IOException;

    List<String> keys(String prefix) throws IOException;

    int purgeExpired() throws IOException;
}
