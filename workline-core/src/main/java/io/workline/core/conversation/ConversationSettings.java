package io.workline.core.conversation;

public record ConversationSettings(
    String model,
    double completionThreshold,
    double requiredWeight,
    double optionalWeight,
    double minFieldConfidence,
    int historyWindow,
    int maxTurns,
    double adversarialCeiling
) {
    public ConversationSettings {
        model = model == null || model.isBlank() ? "gpt-4o-mini" : model.trim();
        if (completionThreshold <= 0 || completionThreshold > 1.0) {
            throw new IllegalArgumentException("completionThreshold must be in (0, 1]");
        }
        if (requiredWeight < 0 || optionalWeight < 0 || Math.abs(requiredWeight + optionalWeight - 1.0) > 1e-6) {
            throw new IllegalArgumentException("requiredWeight and optionalWeight must be non-negative and sum to 1");
        }
        historyWindow = historyWindow <= 0 ? 6 : historyWindow;
        maxTurns = maxTurns <= 0 ? 40 : maxTurns;
        adversarialCeiling = adversarialCeiling <= 0 ? 60.0 : adversarialCeiling;
    }

    public static ConversationSettings defaults() {
        return new ConversationSettings("gpt-4o-mini", 0.9, 0.7, 0.3, 0.5, 6, 40, 60.0);
    }
}
