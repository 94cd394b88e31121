package io.workline.core.session;

import io.workline.core.conversation.ConversationStage;
import io.workline.core.timeline.EmploymentFragment;
import java.util.List;

/**
 * Engine-owned part of a call session. Written back whole after every turn.
 */
public record ConversationState(
    ConversationStage stage,
    int turnCount,
    List<TranscriptEntry> transcript,
    List<EmploymentFragment> fragments,
    List<String> missingFields,
    String nextQuestionFocus,
    double completeness,
    boolean complete,
    String terminationReason
) {
    public ConversationState {
        stage = stage == null ? ConversationStage.GREETING : stage;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        nextQuestionFocus = nextQuestionFocus == null ? "" : nextQuestionFocus;
        terminationReason = terminationReason == null ? "" : terminationReason;
    }

    public static ConversationState initial() {
        return new ConversationState(ConversationStage.GREETING, 0, List.of(), List.of(), List.of(), "", 0.0, false, "");
    }

    public List<String> callerUtterances() {
        return transcript.stream()
            .filter(entry -> entry.speaker() == TranscriptEntry.Speaker.CALLER)
            .map(TranscriptEntry::text)
            .toList();
    }
}
