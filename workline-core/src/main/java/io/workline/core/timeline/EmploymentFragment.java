package io.workline.core.timeline;

import java.util.List;

/**
 * What one conversational turn said about a job, or about a reason for not working
 * when {@code gapReason} is set.
 */
public record EmploymentFragment(
    List<Integer> years,
    String employer,
    String title,
    String industry,
    String gapReason
) {
    public EmploymentFragment {
        years = years == null ? List.of() : years.stream().filter(y -> y != null).sorted().toList();
        employer = blankToNull(employer);
        title = blankToNull(title);
        industry = blankToNull(industry);
        gapReason = blankToNull(gapReason);
    }

    public static EmploymentFragment job(List<Integer> years, String employer, String title, String industry) {
        return new EmploymentFragment(years, employer, title, industry, null);
    }

    public static EmploymentFragment gapReason(List<Integer> years, String reason) {
        return new EmploymentFragment(years, null, null, null, reason);
    }

    public boolean hasYears() {
        return !years.isEmpty();
    }

    public boolean explainsAbsence() {
        return gapReason != null;
    }

    public int firstYear() {
        return years.get(0);
    }

    public int lastYear() {
        return years.get(years.size() - 1);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
