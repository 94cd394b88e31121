package io.workline.core.ratelimit;

import java.time.Instant;

/**
 * @param resetAt when the current window closes; null when no window is open
 */
public record RateLimitStatus(boolean limited, long count, int limit, Instant resetAt) {
}
