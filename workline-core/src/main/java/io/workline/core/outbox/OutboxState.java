package io.workline.core.outbox;

public enum OutboxState {
    PENDING,
    DEAD
}
