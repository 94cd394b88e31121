package io.workline.core.pipeline;

import io.workline.core.session.FieldValue;
import io.workline.core.timeline.EmploymentGap;
import io.workline.core.timeline.EmploymentPeriod;
import io.workline.core.timeline.TimelineAssessment;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The profile delivered to the destination webhook once a call completes.
 */
public record WorkerProfile(
    String callId,
    String callerIdentityHash,
    Instant startedAt,
    Instant completedAt,
    String fullName,
    Map<String, List<FieldValue>> extractedFields,
    List<EmploymentPeriod> employmentPeriods,
    List<EmploymentGap> employmentGaps,
    TimelineAssessment assessment,
    List<String> recommendations,
    double completeness,
    double adversarialScore,
    int turnCount,
    String terminationReason
) {
}
