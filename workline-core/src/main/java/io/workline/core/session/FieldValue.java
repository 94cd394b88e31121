package io.workline.core.session;

import java.time.Instant;
import java.util.Objects;

public record FieldValue(String value, double confidence, Instant capturedAt) {
    public FieldValue {
        value = value == null ? "" : value.trim();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
    }
}
