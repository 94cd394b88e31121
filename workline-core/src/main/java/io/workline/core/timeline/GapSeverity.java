package io.workline.core.timeline;

public enum GapSeverity {
    MINOR(1),
    MODERATE(2),
    MAJOR(3),
    CRITICAL(4);

    private final int rank;

    GapSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
