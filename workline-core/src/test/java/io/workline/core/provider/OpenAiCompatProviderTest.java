package io.workline.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldRequestJsonObjectAndReturnMessageContent() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "{\\"assistant_reply\\":\\"hello\\"}" } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai", "sk-test", server.url("/v1").toString(), Duration.ofSeconds(5)
        );

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(
            ChatMessage.system("You interview callers."),
            ChatMessage.user("hi")
        ));

        assertThat(response.content()).isEqualTo("{\"assistant_reply\":\"hello\"}");
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"json_object\"").contains("\"role\":\"system\"");
    }

    @Test
    void shouldRetryServerErrorsBeforeSucceeding() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"{}\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai", "sk-test", server.url("/v1/").toString(), Duration.ofSeconds(5)
        );

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldReturnErrorResponseForClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("bad key"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai", "sk-wrong", server.url("/v1").toString(), Duration.ofSeconds(5)
        );

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("HTTP 401");
        assertThat(response.usage()).containsEntry("http_status", 401);
    }

    @Test
    void shouldFailFastWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai", "", server.url("/v1").toString(), Duration.ofSeconds(5)
        );

        assertThat(provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi"))).failed()).isTrue();
        assertThat(server.getRequestCount()).isZero();
    }
}
