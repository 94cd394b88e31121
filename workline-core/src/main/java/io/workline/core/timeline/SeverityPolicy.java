package io.workline.core.timeline;

/**
 * Size thresholds, in whole years, separating the gap severities.
 */
public record SeverityPolicy(int minorMaxYears, int moderateMaxYears, int majorMaxYears, int maxSuggestions) {
    public SeverityPolicy {
        if (minorMaxYears < 1 || moderateMaxYears < minorMaxYears || majorMaxYears < moderateMaxYears) {
            throw new IllegalArgumentException(
                "severity thresholds must be positive and ascending: "
                    + minorMaxYears + "/" + moderateMaxYears + "/" + majorMaxYears
            );
        }
        maxSuggestions = maxSuggestions <= 0 ? 6 : maxSuggestions;
    }

    public static SeverityPolicy defaults() {
        return new SeverityPolicy(1, 3, 10, 6);
    }

    public GapSeverity classify(int sizeYears) {
        if (sizeYears <= minorMaxYears) {
            return GapSeverity.MINOR;
        }
        if (sizeYears <= moderateMaxYears) {
            return GapSeverity.MODERATE;
        }
        if (sizeYears <= majorMaxYears) {
            return GapSeverity.MAJOR;
        }
        return GapSeverity.CRITICAL;
    }
}
