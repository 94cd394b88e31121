package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorklineConfig(
    StoreConfig store,
    RateLimitConfig rateLimit,
    ConversationConfig conversation,
    TimelineConfig timeline,
    OutboxConfig outbox,
    ProviderConfig provider,
    ProviderConfig fallbackProvider,
    ServerConfig server
) {
    public WorklineConfig {
        store = store == null ? StoreConfig.defaults() : store;
        rateLimit = rateLimit == null ? RateLimitConfig.defaults() : rateLimit;
        conversation = conversation == null ? ConversationConfig.defaults() : conversation;
        timeline = timeline == null ? TimelineConfig.defaults() : timeline;
        outbox = outbox == null ? OutboxConfig.defaults() : outbox;
        provider = provider == null ? ProviderConfig.defaults() : provider;
        fallbackProvider = fallbackProvider == null ? ProviderConfig.fallbackDefaults() : fallbackProvider;
        server = server == null ? ServerConfig.defaults() : server;
    }

    public static WorklineConfig defaults() {
        return new WorklineConfig(
            StoreConfig.defaults(),
            RateLimitConfig.defaults(),
            ConversationConfig.defaults(),
            TimelineConfig.defaults(),
            OutboxConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.fallbackDefaults(),
            ServerConfig.defaults()
        );
    }

    /**
     * Copy safe to print: API keys are masked.
     */
    public WorklineConfig redacted() {
        return new WorklineConfig(store, rateLimit, conversation, timeline, outbox, provider.redacted(),
            fallbackProvider.redacted(), server);
    }
}
