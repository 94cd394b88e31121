package io.workline.core.store;

public final class StoreKeys {
    public static final String CALL_SESSION = "CALL_SESSION:";
    public static final String RATE_LIMIT = "RATE_LIMIT:";
    public static final String OUTBOX = "OUTBOX:";
    public static final String OUTBOX_DEAD = "OUTBOX_DEAD:";
    public static final String OUTBOX_LEASE = "OUTBOX_LEASE:";
    public static final String HEALTH = "HEALTH:";

    private StoreKeys() {
    }

    public static String callSession(String callId) {
        return CALL_SESSION + requireId(callId);
    }

    public static String rateLimit(String identityHash) {
        return RATE_LIMIT + requireId(identityHash);
    }

    public static String outbox(String eventId) {
        return OUTBOX + requireId(eventId);
    }

    public static String deadLetter(String eventId) {
        return OUTBOX_DEAD + requireId(eventId);
    }

    public static String lease(String eventId) {
        return OUTBOX_LEASE + requireId(eventId);
    }

    public static String health(String probeId) {
        return HEALTH + requireId(probeId);
    }

    public static String idOf(String key, String prefix) {
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        return id.trim();
    }
}
