package io.workline.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.workline.core.config.model.WorklineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@link WorklineConfig} from JSON. Whatever the file leaves out keeps its default, at any
 * nesting depth. Keys may be camelCase or snake_case.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public WorklineConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return WorklineConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(WorklineConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        if (existingNode == null || existingNode.isMissingNode()) {
            return WorklineConfig.defaults();
        }
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, WorklineConfig.class);
    }

    public void save(Path configPath, WorklineConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(WorklineConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config.redacted());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = camelCase(entry.getKey());
            JsonNode existing = merged.get(key);
            merged.set(key, deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    // session_ttl_seconds and sessionTtlSeconds name the same property
    static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
                continue;
            }
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return out.toString();
    }
}
