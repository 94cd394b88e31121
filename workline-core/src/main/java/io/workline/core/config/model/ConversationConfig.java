package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.workline.core.conversation.ConversationSettings;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationConfig(
    String model,
    double completionThreshold,
    double requiredWeight,
    double optionalWeight,
    double minFieldConfidence,
    int historyWindow,
    int maxTurns,
    double adversarialCeiling
) {
    public static ConversationConfig defaults() {
        ConversationSettings settings = ConversationSettings.defaults();
        return new ConversationConfig(
            settings.model(),
            settings.completionThreshold(),
            settings.requiredWeight(),
            settings.optionalWeight(),
            settings.minFieldConfidence(),
            settings.historyWindow(),
            settings.maxTurns(),
            settings.adversarialCeiling()
        );
    }

    public ConversationSettings toSettings() {
        return new ConversationSettings(
            model,
            completionThreshold,
            requiredWeight,
            optionalWeight,
            minFieldConfidence,
            historyWindow,
            maxTurns,
            adversarialCeiling
        );
    }
}
