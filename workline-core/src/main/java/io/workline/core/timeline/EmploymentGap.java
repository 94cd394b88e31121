package io.workline.core.timeline;

import java.util.List;

public record EmploymentGap(
    int startYear,
    int endYear,
    int sizeYears,
    GapSeverity severity,
    List<String> suggestedIndustries,
    List<String> followUpQuestions,
    boolean resolved,
    String resolutionNotes
) {
    public EmploymentGap {
        suggestedIndustries = suggestedIndustries == null ? List.of() : List.copyOf(suggestedIndustries);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
        resolutionNotes = resolutionNotes == null ? "" : resolutionNotes;
    }

    public boolean overlaps(int fromYear, int toYear) {
        return fromYear <= endYear && toYear >= startYear;
    }
}
