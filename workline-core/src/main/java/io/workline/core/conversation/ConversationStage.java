package io.workline.core.conversation;

public enum ConversationStage {
    GREETING,
    IDENTITY,
    EMPLOYMENT,
    GAP_RESOLUTION,
    EDUCATION,
    SKILLS,
    CLOSING
}
