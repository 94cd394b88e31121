package io.workline.core.outbox;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.workline.core.MutableClock;
import io.workline.core.store.InMemoryKeyValueStore;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpWebhookTransportTest {

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
    void shouldDeliverProfileWithIdempotencyHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));
        MutableClock clock = MutableClock.at("2026-05-01T10:00:00Z");
        OutboxStore store = new OutboxStore(
            new InMemoryKeyValueStore(clock), Duration.ofDays(7), Duration.ofDays(30), Duration.ofMinutes(2)
        );

        try (DeliveryOutbox outbox = new DeliveryOutbox(
            store, new OkHttpWebhookTransport(Duration.ofSeconds(5)), BackoffPolicy.defaults(), 2, clock
        )) {
            String eventId = outbox.enqueue("call-7", "hash-7", server.url("/hooks/profile").toString(),
                Map.of("full_name", "Dana Reyes"));

            DrainReport report = outbox.drain(10);

            assertThat(report.delivered()).isEqualTo(1);
            RecordedRequest request = server.takeRequest();
            assertThat(request.getMethod()).isEqualTo("POST");
            assertThat(request.getPath()).isEqualTo("/hooks/profile");
            assertThat(request.getHeader("Idempotency-Key")).isEqualTo(eventId);
            assertThat(request.getHeader("X-Event-ID")).isEqualTo(eventId);
            assertThat(request.getHeader("X-Event-Type")).isEqualTo("worker_profile_completed");
            assertThat(request.getHeader("X-Call-ID")).isEqualTo("call-7");
            assertThat(request.getHeader("User-Agent")).isEqualTo("Workline-Outbox/1.0");

            JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
            assertThat(body.path("eventType").asText()).isEqualTo("worker_profile_completed");
            assertThat(body.path("eventId").asText()).isEqualTo(eventId);
            assertThat(body.path("callId").asText()).isEqualTo("call-7");
            assertThat(body.path("timestamp").asText()).isEqualTo("2026-05-01T10:00:00Z");
            assertThat(body.path("profile").path("full_name").asText()).isEqualTo("Dana Reyes");
        }
    }

    @Test
    void shouldReportNon2xxAsUnsuccessful() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        DeliveryResponse response = new OkHttpWebhookTransport(Duration.ofSeconds(5))
            .send(new DeliveryRequest(server.url("/hook").toString(), Map.of(), "{}"));

        assertThat(response.successful()).isFalse();
        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(response.body()).isEqualTo("boom");
    }

    @Test
    void shouldTurnTimeoutIntoFailureResponse() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        DeliveryResponse response = new OkHttpWebhookTransport(Duration.ofMillis(300))
            .send(new DeliveryRequest(server.url("/hook").toString(), Map.of(), "{}"));

        assertThat(response.successful()).isFalse();
        assertThat(response.statusCode()).isZero();
        assertThat(response.error()).startsWith("Delivery failed:");
    }

    @Test
    void shouldRejectMalformedUrlWithoutThrowing() {
        DeliveryResponse response = new OkHttpWebhookTransport(Duration.ofSeconds(1))
            .send(new DeliveryRequest("not a url", Map.of(), "{}"));

        assertThat(response.successful()).isFalse();
        assertThat(response.error()).startsWith("Invalid destination:");
    }
}
