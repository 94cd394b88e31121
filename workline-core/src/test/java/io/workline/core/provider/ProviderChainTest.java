package io.workline.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderChainTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        StubProvider primary = new StubProvider("openai", "Error calling LLM: timeout");
        StubProvider secondary = new StubProvider("openrouter", "{\"assistant_reply\":\"ok\"}");

        LlmResponse response = new ProviderChain("interview", List.of(primary, secondary))
            .chat("model", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isFalse();
        assertThat(response.content()).contains("ok");
        assertThat(response.usage()).containsEntry("provider", "openrouter");
        assertThat(primary.calls).hasSize(1);
        assertThat(secondary.calls).hasSize(1);
    }

    @Test
    void shouldNotConsultBackupWhenPrimaryAnswers() {
        StubProvider primary = new StubProvider("openai", "{\"assistant_reply\":\"hello\"}");
        StubProvider secondary = new StubProvider("openrouter", "{\"assistant_reply\":\"unused\"}");

        LlmResponse response = new ProviderChain("interview", List.of(primary, secondary))
            .chat("model", List.of(ChatMessage.user("hi")));

        assertThat(response.usage()).containsEntry("provider", "openai");
        assertThat(secondary.calls).isEmpty();
    }

    @Test
    void shouldNameEveryFailureWhenAllProvidersFail() {
        ProviderChain chain = new ProviderChain("interview", List.of(
            new StubProvider("openai", "Error calling LLM: HTTP 401 invalid key"),
            new StubProvider("openrouter", "Error calling LLM: HTTP 503")
        ));

        LlmResponse response = chain.chat("model", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(response.content())
            .startsWith(LlmResponse.ERROR_PREFIX)
            .contains("openai: HTTP 401 invalid key")
            .contains("openrouter: HTTP 503");
        assertThat(response.usage()).containsEntry("failed_providers", 2);
    }

    @Test
    void chainWithoutConfiguredProvidersShouldFail() {
        LlmResponse response = new ProviderChain("interview", List.of()).chat("model", List.of());

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("no provider configured for interview");
    }

    private static final class StubProvider implements LlmProvider {
        private final String name;
        private final String content;
        private final List<String> calls = new ArrayList<>();

        StubProvider(String name, String content) {
            this.name = name;
            this.content = content;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages) {
            calls.add(model);
            return new LlmResponse(content, Map.of());
        }
    }
}
