package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.workline.core.timeline.SeverityPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimelineConfig(int minorMaxYears, int moderateMaxYears, int majorMaxYears, int maxSuggestions) {
    public static TimelineConfig defaults() {
        SeverityPolicy policy = SeverityPolicy.defaults();
        return new TimelineConfig(
            policy.minorMaxYears(),
            policy.moderateMaxYears(),
            policy.majorMaxYears(),
            policy.maxSuggestions()
        );
    }

    public SeverityPolicy toPolicy() {
        return new SeverityPolicy(minorMaxYears, moderateMaxYears, majorMaxYears, maxSuggestions);
    }
}
