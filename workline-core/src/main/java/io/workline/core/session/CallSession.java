package io.workline.core.session;

import io.workline.core.timeline.EmploymentGap;
import io.workline.core.timeline.EmploymentPeriod;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code deliveryPending} marks a completed call whose profile could not be queued yet.
 */
public record CallSession(
    String callId,
    String callerIdentityHash,
    CallStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String destinationUrl,
    ConversationState conversationState,
    Map<String, List<FieldValue>> extractedFields,
    List<EmploymentPeriod> employmentPeriods,
    List<EmploymentGap> employmentGaps,
    double adversarialScore,
    String failureReason,
    boolean deliveryPending
) {
    public CallSession {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId must not be blank");
        }
        callerIdentityHash = callerIdentityHash == null ? "" : callerIdentityHash;
        status = status == null ? CallStatus.QUEUED : status;
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        destinationUrl = destinationUrl == null ? "" : destinationUrl.trim();
        conversationState = conversationState == null ? ConversationState.initial() : conversationState;
        extractedFields = copyFields(extractedFields);
        employmentPeriods = employmentPeriods == null ? List.of() : List.copyOf(employmentPeriods);
        employmentGaps = employmentGaps == null ? List.of() : List.copyOf(employmentGaps);
        failureReason = failureReason == null ? "" : failureReason;
    }

    public static CallSession queued(String callId, String callerIdentityHash, String destinationUrl, Instant now) {
        return new CallSession(
            callId,
            callerIdentityHash,
            CallStatus.QUEUED,
            now,
            null,
            null,
            destinationUrl,
            ConversationState.initial(),
            Map.of(),
            List.of(),
            List.of(),
            0.0,
            "",
            false
        );
    }

    public CallSession apply(SessionPatch patch) {
        if (patch == null) {
            return this;
        }
        return new CallSession(
            callId,
            callerIdentityHash,
            patch.status() != null ? patch.status() : status,
            createdAt,
            patch.startedAt() != null ? patch.startedAt() : startedAt,
            patch.completedAt() != null ? patch.completedAt() : completedAt,
            destinationUrl,
            patch.conversationState() != null ? patch.conversationState() : conversationState,
            patch.extractedFields() != null ? patch.extractedFields() : extractedFields,
            patch.employmentPeriods() != null ? patch.employmentPeriods() : employmentPeriods,
            patch.employmentGaps() != null ? patch.employmentGaps() : employmentGaps,
            patch.adversarialScore() != null ? patch.adversarialScore() : adversarialScore,
            patch.failureReason() != null ? patch.failureReason() : failureReason,
            patch.deliveryPending() != null ? patch.deliveryPending() : deliveryPending
        );
    }

    public List<FieldValue> values(String fieldName) {
        return extractedFields.getOrDefault(fieldName, List.of());
    }

    private static Map<String, List<FieldValue>> copyFields(Map<String, List<FieldValue>> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, List<FieldValue>> copy = new LinkedHashMap<>();
        fields.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
