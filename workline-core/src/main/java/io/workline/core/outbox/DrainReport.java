package io.workline.core.outbox;

public record DrainReport(int due, int delivered, int retried, int deadLettered, int skipped, int errors) {
    public static DrainReport empty() {
        return new DrainReport(0, 0, 0, 0, 0, 0);
    }

    public int attempted() {
        return delivered + retried + deadLettered;
    }
}
