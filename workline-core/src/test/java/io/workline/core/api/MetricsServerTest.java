package io.workline.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.workline.core.MutableClock;
import io.workline.core.observability.PipelineMetrics;
import io.workline.core.outbox.BackoffPolicy;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.outbox.DeliveryResponse;
import io.workline.core.outbox.OutboxStore;
import io.workline.core.store.InMemoryKeyValueStore;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsServerTest {
    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryKeyValueStore kv;
    private PipelineMetrics metrics;
    private DeliveryOutbox outbox;
    private MetricsServer server;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2026-02-10T08:00:00Z");
        kv = new InMemoryKeyValueStore(clock);
        metrics = PipelineMetrics.prometheus();
        outbox = new DeliveryOutbox(
            new OutboxStore(kv, Duration.ofDays(7), Duration.ofDays(30), Duration.ofMinutes(2)),
            request -> new DeliveryResponse(500, "down", "", Duration.ofMillis(2)),
            new BackoffPolicy(Duration.ofSeconds(60), 2.0, Duration.ofHours(1), 1),
            1,
            clock,
            metrics
        );
        server = new MetricsServer(0, "127.0.0.1", metrics, outbox, kv);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        outbox.close();
    }

    @Test
    void shouldExposePrometheusText() throws Exception {
        metrics.callStarted();
        metrics.turn(false);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(type -> assertThat(type).startsWith("text/plain"));
        assertThat(response.body())
            .contains("workline_calls_started_total 1.0")
            .contains("workline_turns_total{result=\"ok\"");
    }

    @Test
    void healthShouldRoundTripTheStore() throws Exception {
        HttpResponse<String> response = get("/healthz");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).path("store").asText()).isEqualTo("ok");
        assertThat(kv.keys("HEALTH:")).isEmpty();
    }

    @Test
    void summaryShouldCombineCallsAndOutbox() throws Exception {
        metrics.callStarted();
        metrics.callFailed("telephony_dropped", Duration.ofSeconds(30));
        outbox.enqueue("call-1", "hash", "https://hooks.example.com/profiles", Map.of());

        JsonNode body = mapper.readTree(get("/summary").body());

        assertThat(body.path("calls").path("callsStarted").asLong()).isEqualTo(1);
        assertThat(body.path("calls").path("callsFailed").asLong()).isEqualTo(1);
        assertThat(body.path("outbox").path("pending").asInt()).isEqualTo(1);
        assertThat(body.path("outbox").path("due").asInt()).isEqualTo(1);
    }

    @Test
    void shouldListAndRequeueDeadLetters() throws Exception {
        String eventId = outbox.enqueue("call-1", "hash", "https://hooks.example.com/profiles", Map.of());
        outbox.drain(10);

        JsonNode listed = mapper.readTree(get("/outbox/dead").body());
        assertThat(listed.path("deadLetters")).hasSize(1);
        assertThat(listed.path("deadLetters").path(0).path("eventId").asText()).isEqualTo(eventId);
        assertThat(listed.path("deadLetters").path(0).path("lastStatusCode").asInt()).isEqualTo(500);

        assertThat(get("/outbox/dead/" + eventId + "/requeue").statusCode()).isEqualTo(405);
        assertThat(post("/outbox/dead/" + eventId + "/requeue").statusCode()).isEqualTo(200);
        assertThat(post("/outbox/dead/" + eventId + "/requeue").statusCode()).isEqualTo(404);
        assertThat(post("/outbox/dead/" + eventId + "/replay").statusCode()).isEqualTo(404);
        assertThat(outbox.pending()).hasSize(1);
        assertThat(outbox.deadLetters()).isEmpty();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }
}
