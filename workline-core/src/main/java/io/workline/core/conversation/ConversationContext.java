package io.workline.core.conversation;

import io.workline.core.session.TranscriptEntry;
import io.workline.core.timeline.ConversationStrategy;
import io.workline.core.timeline.EmploymentGap;
import java.util.List;

/**
 * Everything the language model sees for one turn. Built only from session data, so the same
 * session and utterance always produce the same context.
 */
public record ConversationContext(
    ConversationStage stage,
    List<String> missingFields,
    List<EmploymentGap> priorityGaps,
    ConversationStrategy strategy,
    AdversarialLevel posture,
    double completeness,
    List<TranscriptEntry> recentTurns,
    String utterance
) {
    public ConversationContext {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        priorityGaps = priorityGaps == null ? List.of() : List.copyOf(priorityGaps);
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
        utterance = utterance == null ? "" : utterance;
        posture = posture == null ? AdversarialLevel.LOW : posture;
    }
}
