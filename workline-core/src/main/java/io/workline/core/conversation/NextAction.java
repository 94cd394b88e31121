package io.workline.core.conversation;

public enum NextAction {
    CONTINUE,
    COMPLETE
}
