package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(String name, String apiKey, String apiBase, long timeoutSeconds) {
    public ProviderConfig {
        name = name == null || name.isBlank() ? "openai" : name.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
        apiBase = apiBase == null ? "" : apiBase.trim();
        timeoutSeconds = timeoutSeconds <= 0 ? 20 : timeoutSeconds;
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig("openai", "", "https://api.openai.com/v1", 20);
    }

    public static ProviderConfig fallbackDefaults() {
        return new ProviderConfig("openrouter", "", "https://openrouter.ai/api/v1", 20);
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    ProviderConfig redacted() {
        return configured() ? new ProviderConfig(name, "***", apiBase, timeoutSeconds) : this;
    }
}
