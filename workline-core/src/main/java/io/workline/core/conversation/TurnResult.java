package io.workline.core.conversation;

import io.workline.core.session.CallSession;
import io.workline.core.session.SessionPatch;

/**
 * @param fallback true when the language model failed and a generic prompt was substituted
 */
public record TurnResult(String message, NextAction nextAction, CallSession updatedSession, boolean fallback) {

    /**
     * The engine-owned parts of {@link #updatedSession()}, ready to write back to the session store.
     */
    public SessionPatch sessionPatch() {
        return SessionPatch.empty()
            .withConversationState(updatedSession.conversationState())
            .withExtractedFields(updatedSession.extractedFields())
            .withTimeline(updatedSession.employmentPeriods(), updatedSession.employmentGaps())
            .withAdversarialScore(updatedSession.adversarialScore());
    }
}
