package io.workline.core.timeline;

import java.util.List;
import java.util.Locale;

public enum GapReasonCategory {
    FAMILY(List.of("raising children", "kids", "family", "maternity", "paternity", "caring for", "caregiver")),
    EDUCATION(List.of("school", "college", "university", "training", "certification", "studying")),
    HEALTH(List.of("illness", "sick", "injury", "injured", "recovery", "disability", "surgery")),
    ECONOMIC(List.of("layoff", "laid off", "plant closure", "closed down", "recession", "downsizing")),
    PERSONAL(List.of("travel", "relocation", "moved", "personal reasons")),
    OTHER(List.of());

    private final List<String> keywords;

    GapReasonCategory(List<String> keywords) {
        this.keywords = keywords;
    }

    public static GapReasonCategory categorize(String reason) {
        if (reason == null || reason.isBlank()) {
            return OTHER;
        }
        String normalized = reason.toLowerCase(Locale.ROOT);
        for (GapReasonCategory category : values()) {
            for (String keyword : category.keywords) {
                if (normalized.contains(keyword)) {
                    return category;
                }
            }
        }
        return OTHER;
    }
}
