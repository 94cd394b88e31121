package io.workline.core.outbox;

import java.time.Duration;

/**
 * Exponential retry schedule: the n-th retry waits {@code initialDelay * multiplier^n}, capped
 * at {@code maxDelay}. An entry that has failed {@code maxRetries} times is dead.
 */
public record BackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, int maxRetries) {
    public BackoffPolicy {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be > 0");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(60), 2.0, Duration.ofHours(1), 5);
    }

    public Duration delayFor(int retryCount) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, retryCount));
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean exhausted(int retryCount) {
        return retryCount >= maxRetries;
    }
}
