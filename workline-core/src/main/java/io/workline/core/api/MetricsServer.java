package io.workline.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.workline.core.observability.PipelineMetrics;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.store.KeyValueStore;
import io.workline.core.store.StoreKeys;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator surface: Prometheus scrape, health, summary and dead-letter handling. Store-touching
 * handlers are dispatched off the IO thread.
 */
public final class MetricsServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MetricsServer.class);
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final String host;
    private final int requestedPort;
    private final PipelineMetrics metrics;
    private final DeliveryOutbox outbox;
    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public MetricsServer(int port, String host, PipelineMetrics metrics, DeliveryOutbox outbox, KeyValueStore store) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path()
            .addExactPath("/metrics", exchange -> blocking(exchange, this::handleMetrics))
            .addExactPath("/healthz", exchange -> blocking(exchange, this::handleHealth))
            .addExactPath("/summary", exchange -> blocking(exchange, this::handleSummary))
            .addPrefixPath("/outbox/dead", exchange -> blocking(exchange, this::handleDeadLetters));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Metrics server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleMetrics(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        byte[] body = metrics.scrape().getBytes(StandardCharsets.UTF_8);
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, PROMETHEUS_CONTENT_TYPE);
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String key = StoreKeys.health(UUID.randomUUID().toString());
        try {
            store.put(key, "ok", Duration.ofSeconds(30));
            boolean readable = store.get(key).isPresent();
            store.delete(key);
            if (!readable) {
                sendJson(exchange, 503, Map.of("status", "degraded", "store", "unreadable"));
                return;
            }
        } catch (IOException e) {
            LOG.warn("Health check failed: {}", e.getMessage());
            sendJson(exchange, 503, Map.of("status", "degraded", "store", String.valueOf(e.getMessage())));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "store", "ok"));
    }

    private void handleSummary(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("calls", metrics.summary());
        payload.put("outbox", outbox.stats());
        sendJson(exchange, 200, payload);
    }

    private void handleDeadLetters(HttpServerExchange exchange) throws IOException {
        String relative = exchange.getRelativePath() == null ? "" : exchange.getRelativePath();
        if (relative.isEmpty() || "/".equals(relative)) {
            if (!isMethod(exchange, "GET")) {
                sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
                return;
            }
            sendJson(exchange, 200, Map.of("deadLetters", outbox.deadLetters()));
            return;
        }

        String[] parts = relative.substring(1).split("/");
        if (parts.length != 2 || !"requeue".equals(parts[1]) || parts[0].isBlank()) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        String eventId = parts[0];
        if (!outbox.requeueDead(eventId)) {
            sendJson(exchange, 404, Map.of("error", "dead_letter_not_found", "eventId", eventId));
            return;
        }
        sendJson(exchange, 200, Map.of("requeued", eventId));
    }

    private void blocking(HttpServerExchange exchange, ExchangeHandler handler) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> blocking(exchange, handler));
            return;
        }
        try {
            handler.handle(exchange);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        if (exchange.isResponseStarted()) {
            return;
        }
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        if (undertow.getListenerInfo().isEmpty()) {
            return fallbackPort;
        }
        Object address = undertow.getListenerInfo().get(0).getAddress();
        if (address instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
