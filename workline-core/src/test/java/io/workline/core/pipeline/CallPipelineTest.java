package io.workline.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.workline.core.MutableClock;
import io.workline.core.conversation.ConversationEngine;
import io.workline.core.conversation.ConversationModel;
import io.workline.core.conversation.ConversationSettings;
import io.workline.core.conversation.HeuristicUtteranceClassifier;
import io.workline.core.conversation.MalformedReplyException;
import io.workline.core.conversation.ModelReply;
import io.workline.core.observability.PipelineMetrics;
import io.workline.core.observability.PipelineSummary;
import io.workline.core.outbox.BackoffPolicy;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.outbox.DeliveryResponse;
import io.workline.core.outbox.OutboxStore;
import io.workline.core.ratelimit.RateLimiter;
import io.workline.core.session.CallSession;
import io.workline.core.session.CallStatus;
import io.workline.core.session.SessionStore;
import io.workline.core.store.InMemoryKeyValueStore;
import io.workline.core.store.KeyValueStore;
import io.workline.core.store.StoreKeys;
import io.workline.core.timeline.TimelineAnalyzer;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CallPipelineTest {
    private static final String PHONE = "+1 (313) 555-0142";
    private static final String HOOK = "https://hooks.example.com/profiles";

    private MutableClock clock;
    private InMemoryKeyValueStore kv;
    private OutboxFailingStore outboxKv;
    private SessionStore sessions;
    private DeliveryOutbox outbox;
    private PipelineMetrics metrics;
    private final Deque<Object> script = new ArrayDeque<>();
    private CallPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T15:00:00Z");
        kv = new InMemoryKeyValueStore(clock);
        sessions = new SessionStore(kv, Duration.ofHours(48), Duration.ofHours(72), clock);
        outboxKv = new OutboxFailingStore(kv);
        OutboxStore outboxStore = new OutboxStore(outboxKv, Duration.ofDays(7), Duration.ofDays(30), Duration.ofMinutes(2));
        outbox = new DeliveryOutbox(
            outboxStore,
            request -> new DeliveryResponse(200, "", "", Duration.ZERO),
            BackoffPolicy.defaults(),
            2,
            clock
        );
        metrics = new PipelineMetrics(new SimpleMeterRegistry());
        ConversationModel model = context -> {
            Object next = script.isEmpty() ? new ModelReply("Tell me more.", Map.of(), ModelReply.Analysis.neutral()) : script.poll();
            if (next instanceof MalformedReplyException e) {
                throw e;
            }
            return (ModelReply) next;
        };
        TimelineAnalyzer analyzer = new TimelineAnalyzer();
        ConversationEngine engine = new ConversationEngine(
            model, new HeuristicUtteranceClassifier(), analyzer, ConversationSettings.defaults(), clock
        );
        pipeline = new CallPipeline(
            sessions,
            new RateLimiter(kv, Duration.ofHours(24)),
            2,
            engine,
            analyzer,
            outbox,
            metrics,
            HOOK,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        outbox.close();
    }

    @Test
    void shouldStartActiveCallWithOpeningPrompt() throws Exception {
        CallStart start = pipeline.startCall(PHONE, null);

        assertThat(start.started()).isTrue();
        assertThat(start.openingPrompt()).isEqualTo(CallPipeline.OPENING_PROMPT);
        assertThat(start.callerIdentityHash()).hasSize(16);
        CallSession session = sessions.get(start.callId()).orElseThrow();
        assertThat(session.status()).isEqualTo(CallStatus.ACTIVE);
        assertThat(session.startedAt()).isEqualTo(clock.instant());
        assertThat(session.destinationUrl()).isEqualTo(HOOK);
        assertThat(metrics.summary().callsStarted()).isEqualTo(1);
    }

    @Test
    void shouldRateLimitRepeatCallersUntilWindowCloses() throws Exception {
        assertThat(pipeline.startCall(PHONE, HOOK).started()).isTrue();
        clock.advance(Duration.ofHours(1));
        assertThat(pipeline.startCall("+1 313 555 0142", HOOK).started()).isTrue();

        CallStart third = pipeline.startCall(PHONE, HOOK);

        assertThat(third.status()).isEqualTo(CallStart.Status.RATE_LIMITED);
        assertThat(third.callId()).isEmpty();
        assertThat(third.rateLimit().count()).isEqualTo(2);
        assertThat(third.rateLimit().resetAt()).isEqualTo(clock.instant().plus(Duration.ofHours(23)));
        assertThat(sessions.listActive()).hasSize(2);

        clock.advance(Duration.ofHours(23).plusSeconds(1));
        assertThat(pipeline.startCall(PHONE, HOOK).started()).isTrue();
    }

    @Test
    void unknownOrExpiredCallShouldBeNotFound() throws Exception {
        assertThat(pipeline.handleTurn("call_missing", "hello").status()).isEqualTo(TurnOutcome.Status.NOT_FOUND);

        CallStart start = pipeline.startCall(PHONE, HOOK);
        clock.advance(Duration.ofHours(49));

        TurnOutcome outcome = pipeline.handleTurn(start.callId(), "hello?");

        assertThat(outcome.status()).isEqualTo(TurnOutcome.Status.NOT_FOUND);
        assertThat(outcome.continueCall()).isFalse();
    }

    @Test
    void completedCallShouldQueueProfileDelivery() throws Exception {
        script.add(new ModelReply(
            "Thanks, Dana. Where have you worked?",
            Map.of("full_name", List.of("Dana Reyes")),
            ModelReply.Analysis.neutral()
        ));
        script.add(new ModelReply(
            "Thank you! I have all the information I need.",
            Map.of("employer_name", List.of("Ford"), "job_title", List.of("welder")),
            new ModelReply.Analysis(true, List.of(), "", true)
        ));
        CallStart start = pipeline.startCall(PHONE, HOOK);

        TurnOutcome first = pipeline.handleTurn(start.callId(), "Hi, my name is Dana Reyes");
        clock.advance(Duration.ofMinutes(4));
        TurnOutcome second = pipeline.handleTurn(start.callId(), "I worked at Ford as a welder from 1990 to 1995");

        assertThat(first.continueCall()).isTrue();
        assertThat(second.status()).isEqualTo(TurnOutcome.Status.OK);
        assertThat(second.continueCall()).isFalse();
        assertThat(second.message()).isEqualTo("Thank you! I have all the information I need.");

        CallSession session = sessions.get(start.callId()).orElseThrow();
        assertThat(session.status()).isEqualTo(CallStatus.COMPLETED);
        assertThat(session.completedAt()).isEqualTo(clock.instant());
        assertThat(session.employmentPeriods()).hasSize(1);

        assertThat(outbox.pending()).singleElement().satisfies(entry -> {
            assertThat(entry.callId()).isEqualTo(start.callId());
            assertThat(entry.destinationUrl()).isEqualTo(HOOK);
            assertThat(entry.payload()).containsEntry("fullName", "Dana Reyes");
            assertThat(entry.payload()).containsEntry("callId", start.callId());
            assertThat(entry.payload()).containsKey("employmentPeriods");
        });

        PipelineSummary summary = metrics.summary();
        assertThat(summary.callsCompleted()).isEqualTo(1);
        assertThat(summary.turns()).isEqualTo(2);
        assertThat(summary.meanCallDurationSeconds()).isEqualTo(240.0);

        assertThat(pipeline.handleTurn(start.callId(), "hello?").status())
            .isEqualTo(TurnOutcome.Status.ALREADY_FINISHED);
    }

    @Test
    void malformedModelReplyShouldKeepCallGoing() throws Exception {
        script.add(new MalformedReplyException("not JSON"));
        CallStart start = pipeline.startCall(PHONE, HOOK);

        TurnOutcome outcome = pipeline.handleTurn(start.callId(), "I worked at Kroger in 2001");

        assertThat(outcome.status()).isEqualTo(TurnOutcome.Status.OK);
        assertThat(outcome.continueCall()).isTrue();
        assertThat(outcome.fallback()).isTrue();
        assertThat(outcome.message()).isEqualTo(ConversationEngine.FALLBACK_PROMPT);
        assertThat(sessions.get(start.callId()).orElseThrow().extractedFields()).isEmpty();
        assertThat(metrics.summary().fallbackTurns()).isEqualTo(1);
    }

    @Test
    void failCallShouldMarkFailedOnce() throws Exception {
        CallStart start = pipeline.startCall(PHONE, HOOK);

        assertThat(pipeline.failCall(start.callId(), "telephony_dropped")).isTrue();
        assertThat(pipeline.failCall(start.callId(), "telephony_dropped")).isFalse();

        CallSession session = sessions.get(start.callId()).orElseThrow();
        assertThat(session.status()).isEqualTo(CallStatus.FAILED);
        assertThat(session.failureReason()).isEqualTo("telephony_dropped");
        assertThat(session.completedAt()).isNotNull();
        assertThat(metrics.summary().callsFailed()).isEqualTo(1);
        assertThat(outbox.pending()).isEmpty();
    }

    @Test
    void profileShouldCarryTimelineAssessment() throws Exception {
        CallStart start = pipeline.startCall(PHONE, HOOK);
        pipeline.handleTurn(start.callId(), "I worked at Acme from 1990 to 1995");
        pipeline.handleTurn(start.callId(), "Then I worked at Globex from 2005 to 2010");

        WorkerProfile profile = pipeline.profileFor(sessions.get(start.callId()).orElseThrow());

        assertThat(profile.employmentGaps()).hasSize(1);
        assertThat(profile.assessment().totalGaps()).isEqualTo(1);
        assertThat(profile.turnCount()).isEqualTo(2);
        assertThat(profile.fullName()).isEmpty();
    }

    @Test
    void profileThatCannotBeQueuedShouldStayPendingUntilRedelivered() throws Exception {
        script.add(new ModelReply(
            "Thank you! I have all the information I need.",
            Map.of("full_name", List.of("Dana Reyes")),
            new ModelReply.Analysis(true, List.of(), "", true)
        ));
        CallStart start = pipeline.startCall(PHONE, HOOK);
        outboxKv.failWrites = true;

        TurnOutcome outcome = pipeline.handleTurn(start.callId(), "I'm Dana Reyes, I welded at Ford for years");

        assertThat(outcome.status()).isEqualTo(TurnOutcome.Status.OK);
        assertThat(outcome.continueCall()).isFalse();
        CallSession stuck = sessions.get(start.callId()).orElseThrow();
        assertThat(stuck.status()).isEqualTo(CallStatus.COMPLETED);
        assertThat(stuck.deliveryPending()).isTrue();
        assertThat(sessions.listPendingDelivery()).extracting(CallSession::callId).containsExactly(start.callId());
        assertThat(outbox.pending()).isEmpty();

        // still failing: nothing is lost and the session stays pending
        assertThat(pipeline.redeliverPending()).isZero();
        assertThat(sessions.get(start.callId()).orElseThrow().deliveryPending()).isTrue();

        outboxKv.failWrites = false;
        assertThat(pipeline.redeliverPending()).isEqualTo(1);

        assertThat(outbox.pending()).singleElement().satisfies(entry -> {
            assertThat(entry.callId()).isEqualTo(start.callId());
            assertThat(entry.payload()).containsEntry("fullName", "Dana Reyes");
        });
        assertThat(sessions.get(start.callId()).orElseThrow().deliveryPending()).isFalse();
        assertThat(sessions.listPendingDelivery()).isEmpty();
        assertThat(pipeline.redeliverPending()).isZero();
        assertThat(outbox.pending()).hasSize(1);
    }

    @Test
    void completedCallWithoutDestinationShouldNotStayPending() throws Exception {
        CallPipeline noDefault = new CallPipeline(
            sessions,
            new RateLimiter(kv, Duration.ofHours(24)),
            2,
            new ConversationEngine(
                context -> new ModelReply("Goodbye.", Map.of(), new ModelReply.Analysis(true, List.of(), "", true)),
                new HeuristicUtteranceClassifier(),
                new TimelineAnalyzer(),
                ConversationSettings.defaults(),
                clock
            ),
            new TimelineAnalyzer(),
            outbox,
            metrics,
            "",
            clock
        );
        CallStart start = noDefault.startCall(PHONE, null);

        assertThat(noDefault.handleTurn(start.callId(), "that's everything").continueCall()).isFalse();

        assertThat(sessions.get(start.callId()).orElseThrow().deliveryPending()).isFalse();
        assertThat(noDefault.redeliverPending()).isZero();
        assertThat(outbox.pending()).isEmpty();
    }

    private static final class OutboxFailingStore implements KeyValueStore {
        private final KeyValueStore delegate;
        volatile boolean failWrites;

        OutboxFailingStore(KeyValueStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void put(String key, String value, Duration ttl) throws IOException {
            check(key);
            delegate.put(key, value, ttl);
        }

        @Override
        public Optional<String> get(String key) throws IOException {
            return delegate.get(key);
        }

        @Override
        public boolean replace(String key, String value, Duration ttl) throws IOException {
            check(key);
            return delegate.replace(key, value, ttl);
        }

        @Override
        public boolean putIfAbsent(String key, String value, Duration ttl) throws IOException {
            return delegate.putIfAbsent(key, value, ttl);
        }

        @Override
        public boolean delete(String key) throws IOException {
            return delegate.delete(key);
        }

        @Override
        public long increment(String key, Duration ttlOnCreate) throws IOException {
            return delegate.increment(key, ttlOnCreate);
        }

        @Override
        public Optional<Instant> expiresAt(String key) throws IOException {
            return delegate.expiresAt(key);
        }

        @Override
        public List<String> keys(String prefix) throws IOException {
            return delegate.keys(prefix);
        }

        @Override
        public int purgeExpired() throws IOException {
            return delegate.purgeExpired();
        }

        private void check(String key) throws IOException {
            if (failWrites && key.startsWith(StoreKeys.OUTBOX)) {
                throw new IOException("store unavailable for " + key);
            }
        }
    }
}
