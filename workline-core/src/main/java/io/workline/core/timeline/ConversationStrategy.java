package io.workline.core.timeline;

import java.util.List;

public record ConversationStrategy(
    Approach approach,
    List<String> focusAreas,
    List<String> tips,
    Difficulty expectedDifficulty
) {
    public enum Approach {
        STANDARD,
        GAP_FOCUSED
    }

    public enum Difficulty {
        NORMAL,
        HIGH
    }

    public ConversationStrategy {
        approach = approach == null ? Approach.STANDARD : approach;
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        tips = tips == null ? List.of() : List.copyOf(tips);
        expectedDifficulty = expectedDifficulty == null ? Difficulty.NORMAL : expectedDifficulty;
    }
}
