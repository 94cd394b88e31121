package io.workline.core.conversation;

public enum AdversarialLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static AdversarialLevel of(double score) {
        if (score > 7) {
            return HIGH;
        }
        if (score > 4) {
            return MEDIUM;
        }
        return LOW;
    }
}
