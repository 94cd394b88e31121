package io.workline.core.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks each configured provider in turn until one answers. The answer's usage carries the
 * {@code provider} that served it; when all of them fail the error names every failure.
 */
public final class ProviderChain implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderChain.class);
    private static final int MAX_DETAIL = 300;

    private final String name;
    private final List<LlmProvider> providers;

    public ProviderChain(String name, List<LlmProvider> providers) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
        if (this.providers.isEmpty()) {
            LOG.warn("No language model provider configured for {}; every turn will use the fallback prompt", name);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages) {
        if (providers.isEmpty()) {
            return LlmResponse.error("no provider configured for " + name, Map.of());
        }
        List<String> failures = new ArrayList<>();
        for (LlmProvider provider : providers) {
            LlmResponse response = provider.chat(model, messages);
            if (!response.failed()) {
                if (!failures.isEmpty()) {
                    LOG.info("Model request for {} served by {} after {} failed", name, provider.name(), failures.size());
                }
                Map<String, Object> usage = new LinkedHashMap<>(response.usage());
                usage.put("provider", provider.name());
                return new LlmResponse(response.content(), usage);
            }
            String detail = truncate(response.content().substring(LlmResponse.ERROR_PREFIX.length()).trim());
            failures.add(provider.name() + ": " + detail);
            LOG.warn("Provider {} failed for {} ({} of {}): {}", provider.name(), name, failures.size(), providers.size(), detail);
        }
        return LlmResponse.error(
            "all providers failed for " + name + " [" + String.join("; ", failures) + "]",
            Map.of("failed_providers", failures.size())
        );
    }

    private static String truncate(String value) {
        return value.length() <= MAX_DETAIL ? value : value.substring(0, MAX_DETAIL) + "...";
    }
}
