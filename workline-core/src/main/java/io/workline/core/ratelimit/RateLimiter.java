package io.workline.core.ratelimit;

import io.workline.core.store.KeyValueStore;
import io.workline.core.store.StoreKeys;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window call counter per hashed caller identity. The first increment opens the window;
 * later increments never move its end.
 */
public final class RateLimiter {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    private final KeyValueStore store;
    private final Duration window;

    public RateLimiter(KeyValueStore store, Duration window) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
    }

    public RateLimitStatus check(String identityHash, int limit) throws IOException {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String key = StoreKeys.rateLimit(identityHash);
        long count = store.get(key).map(Long::parseLong).orElse(0L);
        return new RateLimitStatus(count >= limit, count, limit, store.expiresAt(key).orElse(null));
    }

    public long increment(String identityHash) throws IOException {
        long count = store.increment(StoreKeys.rateLimit(identityHash), window);
        LOG.info("Incremented rate limit for caller {} to {}", identityHash, count);
        return count;
    }

    public Duration window() {
        return window;
    }
}
