package io.workline.core.timeline;

public record TimelineAssessment(
    int totalTimelineYears,
    int coveredYears,
    int gapYears,
    double completenessScore,
    int totalGaps,
    int criticalGaps,
    int majorGaps,
    int resolvedGaps,
    boolean needsAttention
) {
    public static TimelineAssessment empty() {
        return new TimelineAssessment(0, 0, 0, 0.0, 0, 0, 0, 0, false);
    }
}
