package io.workline.core.provider;

import java.util.Map;

/**
 * Provider output. Failures are carried as content prefixed with {@link #ERROR_PREFIX}
 * so fallback chains can move on without exceptions.
 */
public record LlmResponse(String content, Map<String, Object> usage) {
    public static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse error(String detail, Map<String, Object> usage) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, usage);
    }

    public boolean failed() {
        return content.startsWith(ERROR_PREFIX);
    }
}
