package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitConfig(int maxCallsPerWindow, long windowSeconds) {
    public RateLimitConfig {
        maxCallsPerWindow = maxCallsPerWindow <= 0 ? 3 : maxCallsPerWindow;
        windowSeconds = windowSeconds <= 0 ? 86_400 : windowSeconds;
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(3, 86_400);
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }
}
