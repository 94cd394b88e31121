package io.workline.core.outbox;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class OkHttpWebhookTransport implements WebhookTransport {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;

    public OkHttpWebhookTransport(Duration timeout) {
        Duration callTimeout = timeout == null || timeout.isNegative() || timeout.isZero()
            ? Duration.ofSeconds(30)
            : timeout;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(callTimeout)
            .writeTimeout(Duration.ofSeconds(10))
            .callTimeout(callTimeout)
            .build();
    }

    @Override
    public DeliveryResponse send(DeliveryRequest request) {
        long started = System.nanoTime();
        try {
            Request.Builder builder = new Request.Builder()
                .url(request.url())
                .post(RequestBody.create(request.body(), JSON));
            for (Map.Entry<String, String> header : request.headers().entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
            try (Response response = client.newCall(builder.build()).execute()) {
                ResponseBody body = response.body();
                return new DeliveryResponse(response.code(), body == null ? "" : body.string(), "", elapsed(started));
            }
        } catch (IOException e) {
            return DeliveryResponse.failure("Delivery failed: " + e.getMessage(), elapsed(started));
        } catch (IllegalArgumentException e) {
            return DeliveryResponse.failure("Invalid destination: " + e.getMessage(), elapsed(started));
        }
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
