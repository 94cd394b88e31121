package io.workline.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.workline.core.config.model.ProviderConfig;
import io.workline.core.config.model.StoreConfig;
import io.workline.core.config.model.WorklineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        WorklineConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.store().backend()).isEqualTo(StoreConfig.SQLITE);
        assertThat(config.store().sessionTtl()).isEqualTo(Duration.ofHours(48));
        assertThat(config.rateLimit().maxCallsPerWindow()).isEqualTo(3);
        assertThat(config.conversation().toSettings().completionThreshold()).isEqualTo(0.9);
        assertThat(config.outbox().backoff().maxRetries()).isEqualTo(5);
        assertThat(config.provider().configured()).isFalse();
        assertThat(config.server().port()).isEqualTo(9464);
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "store": { "backend": "memory" },
              "outbox": { "maxRetries": 8, "destinationUrl": "https://hooks.example.com/profiles" },
              "provider": { "apiKey": "sk-test" },
              "somethingElse": true
            }
            """);

        WorklineConfig config = service.load(configPath);

        assertThat(config.store().backend()).isEqualTo(StoreConfig.MEMORY);
        assertThat(config.store().sessionTtlSeconds()).isEqualTo(172_800);
        assertThat(config.outbox().maxRetries()).isEqualTo(8);
        assertThat(config.outbox().initialDelaySeconds()).isEqualTo(60);
        assertThat(config.outbox().destinationUrl()).isEqualTo("https://hooks.example.com/profiles");
        assertThat(config.provider().apiKey()).isEqualTo("sk-test");
        assertThat(config.provider().apiBase()).isEqualTo("https://api.openai.com/v1");
        assertThat(config.fallbackProvider().configured()).isFalse();
    }

    @Test
    void shouldAcceptSnakeCaseKeys() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "rate_limit": { "max_calls_per_window": 5 },
              "timeline": { "major_max_years": 12 },
              "provider": { "api_key": "sk-snake" }
            }
            """);

        WorklineConfig config = service.load(configPath);

        assertThat(config.rateLimit().maxCallsPerWindow()).isEqualTo(5);
        assertThat(config.rateLimit().windowSeconds()).isEqualTo(86_400);
        assertThat(config.timeline().toPolicy().majorMaxYears()).isEqualTo(12);
        assertThat(config.provider().apiKey()).isEqualTo("sk-snake");
    }

    @Test
    void shouldRejectInconsistentWeights() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "conversation": { "requiredWeight": 0.9 } }
            """);

        WorklineConfig config = service.load(configPath);

        assertThatThrownBy(() -> config.conversation().toSettings())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sum to 1");
    }

    @Test
    void shouldFailOnMalformedJson() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{ not json");

        assertThatThrownBy(() -> service.load(configPath)).isInstanceOf(IOException.class);
    }

    @Test
    void saveShouldRoundTripAndPrettyJsonShouldMaskKeys() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("nested/config.json");
        WorklineConfig original = WorklineConfig.defaults();
        WorklineConfig withKey = new WorklineConfig(
            original.store(), original.rateLimit(), original.conversation(), original.timeline(),
            original.outbox(), new ProviderConfig("openai", "sk-secret", "https://api.openai.com/v1", 20),
            original.fallbackProvider(), original.server()
        );

        service.save(configPath, withKey);

        assertThat(service.load(configPath)).isEqualTo(withKey);
        assertThat(service.toPrettyJson(withKey)).doesNotContain("sk-secret").contains("***");
    }

    @Test
    void configPathShouldHonorEnvironmentOverride() {
        assertThat(ConfigPaths.configPath(Map.of(ConfigPaths.CONFIG_ENV, "/etc/workline/config.json")))
            .isEqualTo(Path.of("/etc/workline/config.json"));
        assertThat(ConfigPaths.configPath(Map.of()).getFileName().toString()).isEqualTo("config.json");
        assertThat(ConfigService.camelCase("session_ttl_seconds")).isEqualTo("sessionTtlSeconds");
        assertThat(ConfigService.camelCase("apiKey")).isEqualTo("apiKey");
    }
}
