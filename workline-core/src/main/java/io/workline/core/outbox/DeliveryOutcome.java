package io.workline.core.outbox;

import java.util.Locale;

public enum DeliveryOutcome {
    SUCCESS,
    RETRY,
    DEAD_LETTER;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
