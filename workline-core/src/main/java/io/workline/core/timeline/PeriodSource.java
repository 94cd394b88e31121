package io.workline.core.timeline;

public enum PeriodSource {
    EXTRACTED,
    /** Bridged across missing years only because both sides named the same employer. */
    INFERRED
}
