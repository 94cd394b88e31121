package io.workline.core.outbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DeliveryRequest(String url, Map<String, String> headers, String body) {
    public DeliveryRequest {
        Objects.requireNonNull(url, "url must not be null");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
    }
}
