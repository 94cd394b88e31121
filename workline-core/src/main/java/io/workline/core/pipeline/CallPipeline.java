package io.workline.core.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.workline.core.conversation.ConversationEngine;
import io.workline.core.conversation.FieldCatalog;
import io.workline.core.conversation.NextAction;
import io.workline.core.conversation.TurnResult;
import io.workline.core.observability.PipelineMetrics;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.ratelimit.RateLimitStatus;
import io.workline.core.ratelimit.RateLimiter;
import io.workline.core.session.CallSession;
import io.workline.core.session.CallStatus;
import io.workline.core.session.CallerIdentity;
import io.workline.core.session.ConversationState;
import io.workline.core.session.FieldValue;
import io.workline.core.session.SessionPatch;
import io.workline.core.session.SessionStore;
import io.workline.core.timeline.TimelineAnalysis;
import io.workline.core.timeline.TimelineAnalyzer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the caller-facing adapter. Holds no call state of its own: every turn reads
 * the session from the store and writes it back.
 */
public final class CallPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(CallPipeline.class);

    public static final String OPENING_PROMPT = "Hello! I'm calling to learn about your work experience so we can "
        + "put together your profile. To start, could you tell me your name?";

    private final SessionStore sessions;
    private final RateLimiter rateLimiter;
    private final int maxCallsPerWindow;
    private final ConversationEngine engine;
    private final TimelineAnalyzer analyzer;
    private final DeliveryOutbox outbox;
    private final PipelineMetrics metrics;
    private final String defaultDestinationUrl;
    private final Clock clock;
    private final ObjectMapper mapper;

    public CallPipeline(
        SessionStore sessions,
        RateLimiter rateLimiter,
        int maxCallsPerWindow,
        ConversationEngine engine,
        TimelineAnalyzer analyzer,
        DeliveryOutbox outbox,
        PipelineMetrics metrics,
        String defaultDestinationUrl,
        Clock clock
    ) {
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        if (maxCallsPerWindow <= 0) {
            throw new IllegalArgumentException("maxCallsPerWindow must be > 0");
        }
        this.maxCallsPerWindow = maxCallsPerWindow;
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.defaultDestinationUrl = defaultDestinationUrl == null ? "" : defaultDestinationUrl.trim();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CallStart startCall(String phoneNumber, String destinationUrl) throws IOException {
        String identityHash = CallerIdentity.hash(phoneNumber);
        RateLimitStatus status = rateLimiter.check(identityHash, maxCallsPerWindow);
        if (status.limited()) {
            LOG.info("Caller {} is rate limited ({} of {} calls)", identityHash, status.count(), status.limit());
            return new CallStart(CallStart.Status.RATE_LIMITED, "", identityHash, "", status);
        }
        long count = rateLimiter.increment(identityHash);
        if (count > maxCallsPerWindow) {
            // another call from the same caller got in between the check and the increment
            RateLimitStatus raced = rateLimiter.check(identityHash, maxCallsPerWindow);
            LOG.info("Caller {} hit the rate limit concurrently", identityHash);
            return new CallStart(CallStart.Status.RATE_LIMITED, "", identityHash, "", raced);
        }

        String callId = "call_" + UUID.randomUUID().toString().replace("-", "");
        String destination = destinationUrl == null || destinationUrl.isBlank() ? defaultDestinationUrl : destinationUrl.trim();
        Instant now = clock.instant();
        sessions.create(callId, identityHash, destination, SessionPatch.status(CallStatus.ACTIVE).withStartedAt(now));
        metrics.callStarted();
        return new CallStart(
            CallStart.Status.STARTED,
            callId,
            identityHash,
            OPENING_PROMPT,
            rateLimiter.check(identityHash, maxCallsPerWindow)
        );
    }

    public TurnOutcome handleTurn(String callId, String utterance) throws IOException {
        Optional<CallSession> current = sessions.get(callId);
        if (current.isEmpty()) {
            LOG.warn("Turn for unknown or expired call {}", callId);
            return TurnOutcome.notFound();
        }
        CallSession session = current.get();
        if (session.status().terminal()) {
            return TurnOutcome.alreadyFinished();
        }

        TurnResult result = engine.turn(session, utterance);
        metrics.turn(result.fallback());
        if (result.nextAction() != NextAction.COMPLETE) {
            if (!sessions.update(callId, result.sessionPatch())) {
                return TurnOutcome.notFound();
            }
            return new TurnOutcome(TurnOutcome.Status.OK, result.message(), true, result.fallback());
        }

        // queue the profile before the session turns COMPLETED
        SessionPatch patch = result.sessionPatch().withStatus(CallStatus.COMPLETED).withCompletedAt(clock.instant());
        CallSession completed = result.updatedSession().apply(patch);
        boolean queued = queueDelivery(completed);
        if (!sessions.update(callId, patch.withDeliveryPending(!queued))) {
            if (queued) {
                LOG.warn("Call {} expired while completing; its profile was already queued", callId);
            }
            return TurnOutcome.notFound();
        }
        ConversationState state = completed.conversationState();
        double meanScore = completed.adversarialScore() / Math.max(1, state.turnCount());
        metrics.callCompleted(meanScore, durationOf(completed));
        LOG.info("Call {} completed after {} turns (completeness {})", callId, state.turnCount(), state.completeness());
        return new TurnOutcome(TurnOutcome.Status.OK, result.message(), false, result.fallback());
    }

    /**
     * Re-queues the profiles of completed calls whose delivery could not be queued when they
     * finished. Returns how many were queued this time.
     */
    public int redeliverPending() throws IOException {
        int queued = 0;
        for (CallSession session : sessions.listPendingDelivery()) {
            if (!queueDelivery(session)) {
                continue;
            }
            if (sessions.update(session.callId(), SessionPatch.empty().withDeliveryPending(false))) {
                queued++;
            }
        }
        if (queued > 0) {
            LOG.info("Re-queued {} pending profile deliveries", queued);
        }
        return queued;
    }

    public boolean failCall(String callId, String reason) throws IOException {
        Optional<CallSession> current = sessions.get(callId);
        if (current.isEmpty() || current.get().status().terminal()) {
            return false;
        }
        String failure = reason == null || reason.isBlank() ? "unknown" : reason.trim();
        if (!sessions.update(callId, SessionPatch.status(CallStatus.FAILED).withFailureReason(failure))) {
            return false;
        }
        metrics.callFailed(failure, durationOf(current.get()));
        LOG.warn("Call {} failed: {}", callId, failure);
        return true;
    }

    public WorkerProfile profileFor(CallSession session) {
        ConversationState state = session.conversationState();
        TimelineAnalysis timeline = analyzer.analyze(state.fragments());
        return new WorkerProfile(
            session.callId(),
            session.callerIdentityHash(),
            session.startedAt(),
            session.completedAt(),
            best(session.values(FieldCatalog.FULL_NAME)),
            session.extractedFields(),
            timeline.periods(),
            timeline.gaps(),
            timeline.assessment(),
            timeline.recommendations(),
            state.completeness(),
            session.adversarialScore(),
            state.turnCount(),
            state.terminationReason()
        );
    }

    public Optional<CallSession> session(String callId) throws IOException {
        return sessions.get(callId);
    }

    public List<CallSession> activeCalls() throws IOException {
        return sessions.listActive();
    }

    /**
     * Returns false only when the profile should have been queued and was not.
     */
    private boolean queueDelivery(CallSession session) {
        if (session.destinationUrl().isBlank()) {
            LOG.warn("Call {} has no destination; profile not delivered", session.callId());
            return true;
        }
        try {
            Map<String, Object> payload = mapper.convertValue(profileFor(session), new TypeReference<Map<String, Object>>() {
            });
            outbox.enqueue(session.callId(), session.callerIdentityHash(), session.destinationUrl(), payload);
            return true;
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Failed to queue profile delivery for call {}; left pending", session.callId(), e);
            return false;
        }
    }

    private Duration durationOf(CallSession session) {
        Instant started = session.startedAt() != null ? session.startedAt() : session.createdAt();
        Instant ended = session.completedAt() != null ? session.completedAt() : clock.instant();
        return Duration.between(started, ended);
    }

    private static String best(List<FieldValue> values) {
        return values.stream()
            .max(Comparator.comparingDouble(FieldValue::confidence).thenComparing(FieldValue::capturedAt))
            .map(FieldValue::value)
            .orElse("");
    }
}
