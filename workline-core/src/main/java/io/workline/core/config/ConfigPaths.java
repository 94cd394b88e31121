package io.workline.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "WORKLINE_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return configPath(System.getenv());
    }

    static Path configPath(Map<String, String> env) {
        String raw = env.get(CONFIG_ENV);
        if (raw == null || raw.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".workline", "config.json");
        }
        return expandHome(raw.trim());
    }

    public static Path expandHome(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".workline");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
