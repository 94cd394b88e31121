package io.workline.core.session;

import io.workline.core.timeline.EmploymentGap;
import io.workline.core.timeline.EmploymentPeriod;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Partial session update. Null components leave the stored value untouched.
 */
public record SessionPatch(
    CallStatus status,
    Instant startedAt,
    Instant completedAt,
    ConversationState conversationState,
    Map<String, List<FieldValue>> extractedFields,
    List<EmploymentPeriod> employmentPeriods,
    List<EmploymentGap> employmentGaps,
    Double adversarialScore,
    String failureReason,
    Boolean deliveryPending
) {
    public static SessionPatch empty() {
        return new SessionPatch(null, null, null, null, null, null, null, null, null, null);
    }

    public static SessionPatch status(CallStatus status) {
        return empty().withStatus(status);
    }

    public SessionPatch withStatus(CallStatus value) {
        return new SessionPatch(value, startedAt, completedAt, conversationState, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withStartedAt(Instant value) {
        return new SessionPatch(status, value, completedAt, conversationState, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withCompletedAt(Instant value) {
        return new SessionPatch(status, startedAt, value, conversationState, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withConversationState(ConversationState value) {
        return new SessionPatch(status, startedAt, completedAt, value, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withExtractedFields(Map<String, List<FieldValue>> value) {
        return new SessionPatch(status, startedAt, completedAt, conversationState, value,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withTimeline(List<EmploymentPeriod> periods, List<EmploymentGap> gaps) {
        return new SessionPatch(status, startedAt, completedAt, conversationState, extractedFields,
            periods, gaps, adversarialScore, failureReason, deliveryPending);
    }

    public SessionPatch withAdversarialScore(double value) {
        return new SessionPatch(status, startedAt, completedAt, conversationState, extractedFields,
            employmentPeriods, employmentGaps, value, failureReason, deliveryPending);
    }

    public SessionPatch withFailureReason(String value) {
        return new SessionPatch(status, startedAt, completedAt, conversationState, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, value, deliveryPending);
    }

    public SessionPatch withDeliveryPending(boolean value) {
        return new SessionPatch(status, startedAt, completedAt, conversationState, extractedFields,
            employmentPeriods, employmentGaps, adversarialScore, failureReason, value);
    }
}
