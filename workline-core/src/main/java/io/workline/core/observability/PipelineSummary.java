package io.workline.core.observability;

public record PipelineSummary(
    long callsStarted,
    long callsCompleted,
    long callsFailed,
    double completionRate,
    long turns,
    long fallbackTurns,
    long deliveriesSucceeded,
    long deliveriesRetried,
    long deliveriesDeadLettered,
    double meanCallDurationSeconds,
    double meanAdversarialScore
) {
}
