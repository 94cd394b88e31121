package io.workline.core.session;

public enum CallStatus {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
