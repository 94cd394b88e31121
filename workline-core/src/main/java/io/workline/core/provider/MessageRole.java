package io.workline.core.provider;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
