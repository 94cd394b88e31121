package io.workline.core.timeline;

import java.util.List;

public record TimelineAnalysis(
    List<EmploymentPeriod> periods,
    List<EmploymentGap> gaps,
    TimelineAssessment assessment,
    List<String> recommendations
) {
    public TimelineAnalysis {
        periods = periods == null ? List.of() : List.copyOf(periods);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        assessment = assessment == null ? TimelineAssessment.empty() : assessment;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static TimelineAnalysis empty() {
        return new TimelineAnalysis(List.of(), List.of(), TimelineAssessment.empty(), List.of());
    }

    public List<EmploymentGap> openGaps() {
        return gaps.stream().filter(gap -> !gap.resolved()).toList();
    }
}
