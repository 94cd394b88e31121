package io.workline.core.timeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Rebuilds the employment timeline from scratch on every call. Output depends only on the
 * fragment list and the severity policy.
 */
public final class TimelineAnalyzer {
    private static final int TRADITIONAL_ERA_BEFORE = 1990;
    private static final int SHORT_GAP_YEARS = 2;
    private static final double LOW_CONFIDENCE = 0.5;
    private static final int LONG_HISTORY_YEARS = 30;
    private static final List<String> TRADITIONAL_INDUSTRIES = List.of("manufacturing", "construction", "retail");
    private static final List<String> RECENT_INDUSTRIES = List.of("retail", "food service", "healthcare", "warehouse");

    private static final Comparator<EmploymentPeriod> PERIOD_ORDER = Comparator
        .comparingInt(EmploymentPeriod::startYear)
        .thenComparingInt(EmploymentPeriod::endYear)
        .thenComparing(p -> p.employer() == null ? "" : p.employer())
        .thenComparing(p -> p.title() == null ? "" : p.title());

    private final SeverityPolicy policy;

    public TimelineAnalyzer() {
        this(SeverityPolicy.defaults());
    }

    public TimelineAnalyzer(SeverityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public TimelineAnalysis analyze(List<EmploymentFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return TimelineAnalysis.empty();
        }
        List<EmploymentPeriod> periods = mergePeriods(candidates(fragments));
        List<EmploymentFragment> reasons = fragments.stream()
            .filter(f -> f.hasYears() && f.explainsAbsence())
            .toList();
        List<EmploymentGap> gaps = detectGaps(periods, reasons);
        TimelineAssessment assessment = assess(periods, gaps);
        return new TimelineAnalysis(periods, gaps, assessment, recommendations(periods, gaps));
    }

    /**
     * Orders gaps most severe first, larger before smaller within a severity.
     */
    public List<EmploymentGap> prioritize(List<EmploymentGap> gaps) {
        if (gaps == null) {
            return List.of();
        }
        return gaps.stream()
            .sorted(Comparator.comparingInt((EmploymentGap g) -> g.severity().rank())
                .thenComparingInt(EmploymentGap::sizeYears)
                .reversed())
            .toList();
    }

    public ConversationStrategy suggestStrategy(TimelineAnalysis analysis) {
        ConversationStrategy.Approach approach = ConversationStrategy.Approach.STANDARD;
        ConversationStrategy.Difficulty difficulty = ConversationStrategy.Difficulty.NORMAL;
        List<String> focusAreas = new ArrayList<>();
        List<String> tips = new ArrayList<>();

        List<EmploymentGap> open = analysis.openGaps();
        boolean critical = open.stream().anyMatch(g -> g.severity() == GapSeverity.CRITICAL);
        if (critical) {
            approach = ConversationStrategy.Approach.GAP_FOCUSED;
            focusAreas.add("large_employment_gaps");
            tips.add("Break large gaps into smaller periods");
            difficulty = ConversationStrategy.Difficulty.HIGH;
        }
        if (analysis.assessment().completenessScore() < 0.5) {
            tips.add("Timeline is incomplete - gather basic employment history first");
        }
        if (open.size() > 5) {
            tips.add("Many gaps detected - focus on the largest ones first");
            difficulty = ConversationStrategy.Difficulty.HIGH;
        }
        return new ConversationStrategy(approach, focusAreas, tips, difficulty);
    }

    private List<EmploymentPeriod> candidates(List<EmploymentFragment> fragments) {
        List<EmploymentPeriod> candidates = new ArrayList<>();
        for (EmploymentFragment fragment : fragments) {
            if (fragment == null || !fragment.hasYears() || fragment.explainsAbsence()) {
                continue;
            }
            candidates.add(new EmploymentPeriod(
                fragment.firstYear(),
                fragment.lastYear(),
                fragment.employer(),
                fragment.title(),
                fragment.industry(),
                confidence(fragment),
                PeriodSource.EXTRACTED
            ));
        }
        candidates.sort(PERIOD_ORDER);
        return candidates;
    }

    private List<EmploymentPeriod> mergePeriods(List<EmploymentPeriod> sorted) {
        List<EmploymentPeriod> merged = new ArrayList<>();
        for (EmploymentPeriod current : sorted) {
            if (merged.isEmpty()) {
                merged.add(current);
                continue;
            }
            EmploymentPeriod last = merged.get(merged.size() - 1);
            boolean touching = current.startYear() <= last.endYear() + 1;
            if (touching || last.sameEmployer(current)) {
                PeriodSource source = touching && current.source() == PeriodSource.EXTRACTED
                    ? last.source()
                    : PeriodSource.INFERRED;
                merged.set(merged.size() - 1, new EmploymentPeriod(
                    last.startYear(),
                    Math.max(last.endYear(), current.endYear()),
                    last.employer() != null ? last.employer() : current.employer(),
                    last.title() != null ? last.title() : current.title(),
                    last.industry() != null ? last.industry() : current.industry(),
                    Math.max(last.confidence(), current.confidence()),
                    source
                ));
            } else {
                merged.add(current);
            }
        }
        return merged;
    }

    private List<EmploymentGap> detectGaps(List<EmploymentPeriod> periods, List<EmploymentFragment> reasons) {
        List<EmploymentGap> gaps = new ArrayList<>();
        for (int i = 0; i + 1 < periods.size(); i++) {
            EmploymentPeriod before = periods.get(i);
            EmploymentPeriod after = periods.get(i + 1);
            if (after.startYear() <= before.endYear() + 1) {
                continue;
            }
            int start = before.endYear() + 1;
            int end = after.startYear() - 1;
            int size = end - start + 1;
            GapSeverity severity = policy.classify(size);
            List<String> industries = suggestIndustries(start, size, before, after);
            String resolution = resolution(start, end, reasons);
            gaps.add(new EmploymentGap(
                start,
                end,
                size,
                severity,
                industries,
                followUpQuestions(start, end, size, severity, industries),
                !resolution.isEmpty(),
                resolution
            ));
        }
        return gaps;
    }

    private List<String> suggestIndustries(int start, int size, EmploymentPeriod before, EmploymentPeriod after) {
        Set<String> suggestions = new LinkedHashSet<>();
        if (size <= SHORT_GAP_YEARS) {
            if (before.industry() != null) {
                suggestions.add(before.industry());
            }
            if (after.industry() != null) {
                suggestions.add(after.industry());
            }
        }
        suggestions.addAll(start < TRADITIONAL_ERA_BEFORE ? TRADITIONAL_INDUSTRIES : RECENT_INDUSTRIES);
        return suggestions.stream().limit(policy.maxSuggestions()).toList();
    }

    private List<String> followUpQuestions(int start, int end, int size, GapSeverity severity, List<String> industries) {
        List<String> questions = new ArrayList<>();
        switch (severity) {
            case CRITICAL -> {
                int midpoint = start + size / 2;
                questions.add("That's a long period from " + start + " to " + end
                    + ". Let's break it down - what were you doing around " + midpoint + "?");
                questions.add("Were you perhaps working in construction, manufacturing, or retail during the "
                    + (start / 10 * 10) + "s?");
            }
            case MAJOR -> {
                questions.add("What about between " + start + " and " + end
                    + "? Were you working anywhere during that time?");
                questions.add("Did you have any jobs, even part-time or temporary, between "
                    + start + " and " + end + "?");
            }
            default -> questions.add("What were you doing between " + start + " and " + end + "?");
        }
        if (!industries.isEmpty()) {
            questions.add("Were you perhaps working in "
                + String.join(", ", industries.subList(0, Math.min(3, industries.size())))
                + " during that time?");
        }
        return questions;
    }

    private String resolution(int start, int end, List<EmploymentFragment> reasons) {
        for (EmploymentFragment reason : reasons) {
            if (reason.firstYear() <= end && reason.lastYear() >= start) {
                String category = GapReasonCategory.categorize(reason.gapReason()).name().toLowerCase(Locale.ROOT);
                return category + ": " + reason.gapReason();
            }
        }
        return "";
    }

    private TimelineAssessment assess(List<EmploymentPeriod> periods, List<EmploymentGap> gaps) {
        if (periods.isEmpty()) {
            return TimelineAssessment.empty();
        }
        int earliest = periods.stream().mapToInt(EmploymentPeriod::startYear).min().orElse(0);
        int latest = periods.stream().mapToInt(EmploymentPeriod::endYear).max().orElse(0);
        int total = latest - earliest + 1;
        int covered = periods.stream().mapToInt(EmploymentPeriod::years).sum();
        int gapYears = gaps.stream().mapToInt(EmploymentGap::sizeYears).sum();
        int critical = count(gaps, GapSeverity.CRITICAL);
        int major = count(gaps, GapSeverity.MAJOR);
        int resolved = (int) gaps.stream().filter(EmploymentGap::resolved).count();
        double completeness = total > 0 ? (double) covered / total : 0.0;
        return new TimelineAssessment(
            total,
            covered,
            gapYears,
            completeness,
            gaps.size(),
            critical,
            major,
            resolved,
            critical > 0 || major > 2
        );
    }

    private List<String> recommendations(List<EmploymentPeriod> periods, List<EmploymentGap> gaps) {
        List<String> recommendations = new ArrayList<>();
        if (count(gaps, GapSeverity.CRITICAL) > 0) {
            recommendations.add("Focus on resolving large employment gaps by breaking them into smaller periods");
        }
        if (count(gaps, GapSeverity.MAJOR) > 2) {
            recommendations.add("Multiple significant gaps detected - prioritize the most recent ones");
        }
        if (periods.stream().anyMatch(p -> p.confidence() < LOW_CONFIDENCE)) {
            recommendations.add("Gather more details for employment periods with limited information");
        }
        if (!periods.isEmpty()) {
            int latest = periods.stream().mapToInt(EmploymentPeriod::endYear).max().orElse(0);
            int span = latest - periods.get(0).startYear();
            if (span > LONG_HISTORY_YEARS) {
                recommendations.add("Long employment history - focus on most recent 20-25 years");
            }
        }
        return recommendations;
    }

    private static int count(List<EmploymentGap> gaps, GapSeverity severity) {
        return (int) gaps.stream().filter(g -> g.severity() == severity).count();
    }

    private static double confidence(EmploymentFragment fragment) {
        double score = 0.0;
        if (fragment.hasYears()) {
            score += 0.4;
        }
        if (fragment.employer() != null) {
            score += 0.3;
        }
        if (fragment.title() != null) {
            score += 0.2;
        }
        if (fragment.industry() != null) {
            score += 0.1;
        }
        return Math.round(Math.min(score, 1.0) * 100) / 100.0;
    }
}
