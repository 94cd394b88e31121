package io.workline.core.outbox;

import java.time.Duration;

/**
 * Outcome of one delivery attempt. {@code statusCode} is 0 when no HTTP response arrived.
 */
public record DeliveryResponse(int statusCode, String body, String error, Duration latency) {
    private static final int MAX_BODY = 1000;

    public DeliveryResponse {
        body = body == null ? "" : body.length() > MAX_BODY ? body.substring(0, MAX_BODY) : body;
        error = error == null ? "" : error;
        latency = latency == null ? Duration.ZERO : latency;
    }

    public static DeliveryResponse failure(String error, Duration latency) {
        return new DeliveryResponse(0, "", error, latency);
    }

    public boolean successful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String describe() {
        if (statusCode == 0) {
            return error.isBlank() ? "no response" : error;
        }
        return "HTTP " + statusCode;
    }
}
