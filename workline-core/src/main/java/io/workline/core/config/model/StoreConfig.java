package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String backend,
    String sqlitePath,
    long sessionTtlSeconds,
    long sessionMaxLifetimeSeconds,
    long purgeIntervalSeconds
) {
    public static final String SQLITE = "sqlite";
    public static final String MEMORY = "memory";

    public StoreConfig {
        backend = backend == null || backend.isBlank() ? SQLITE : backend.trim().toLowerCase(Locale.ROOT);
        sqlitePath = sqlitePath == null || sqlitePath.isBlank() ? "~/.workline/state.db" : sqlitePath.trim();
        sessionTtlSeconds = sessionTtlSeconds <= 0 ? 172_800 : sessionTtlSeconds;
        sessionMaxLifetimeSeconds = sessionMaxLifetimeSeconds <= 0 ? 259_200 : sessionMaxLifetimeSeconds;
        purgeIntervalSeconds = purgeIntervalSeconds <= 0 ? 300 : purgeIntervalSeconds;
    }

    public static StoreConfig defaults() {
        return new StoreConfig(SQLITE, "~/.workline/state.db", 172_800, 259_200, 300);
    }

    public Duration sessionTtl() {
        return Duration.ofSeconds(sessionTtlSeconds);
    }

    public Duration sessionMaxLifetime() {
        return Duration.ofSeconds(sessionMaxLifetimeSeconds);
    }
}
