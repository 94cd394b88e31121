package io.workline.core.timeline;

public record EmploymentPeriod(
    int startYear,
    int endYear,
    String employer,
    String title,
    String industry,
    double confidence,
    PeriodSource source
) {
    public EmploymentPeriod {
        if (endYear < startYear) {
            throw new IllegalArgumentException("endYear must not precede startYear");
        }
        source = source == null ? PeriodSource.EXTRACTED : source;
    }

    public int years() {
        return endYear - startYear + 1;
    }

    boolean sameEmployer(EmploymentPeriod other) {
        return employer != null && other.employer != null && employer.equalsIgnoreCase(other.employer);
    }
}
