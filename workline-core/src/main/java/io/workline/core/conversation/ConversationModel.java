package io.workline.core.conversation;

public interface ConversationModel {
    ModelReply respond(ConversationContext context) throws MalformedReplyException;
}
