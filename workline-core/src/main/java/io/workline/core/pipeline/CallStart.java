package io.workline.core.pipeline;

import io.workline.core.ratelimit.RateLimitStatus;

public record CallStart(Status status, String callId, String callerIdentityHash, String openingPrompt, RateLimitStatus rateLimit) {
    public enum Status {
        STARTED,
        RATE_LIMITED
    }

    public boolean started() {
        return status == Status.STARTED;
    }
}
