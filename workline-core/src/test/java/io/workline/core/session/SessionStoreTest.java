package io.workline.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.workline.core.MutableClock;
import io.workline.core.conversation.ConversationStage;
import io.workline.core.store.InMemoryKeyValueStore;
import io.workline.core.store.SqliteKeyValueStore;
import io.workline.core.timeline.EmploymentFragment;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionStoreTest {
    private static final Duration TTL = Duration.ofHours(48);
    private static final Duration MAX_LIFETIME = Duration.ofHours(72);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemoryKeyValueStore kv;
    private SessionStore sessions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-04-01T09:00:00Z");
        kv = new InMemoryKeyValueStore(clock);
        sessions = new SessionStore(kv, TTL, MAX_LIFETIME, clock);
    }

    @Test
    void shouldCreateAndReadBackSession() throws Exception {
        CallSession created = sessions.create("call-1", "abc123", "https://hooks.example.com/profile",
            SessionPatch.status(CallStatus.ACTIVE).withStartedAt(clock.instant()));

        CallSession loaded = sessions.get("call-1").orElseThrow();

        assertThat(loaded).isEqualTo(created);
        assertThat(loaded.status()).isEqualTo(CallStatus.ACTIVE);
        assertThat(loaded.conversationState().stage()).isEqualTo(ConversationStage.GREETING);
    }

    @Test
    void shouldRejectDuplicateCreate() throws Exception {
        sessions.create("call-1", "abc123", "", SessionPatch.empty());

        assertThatThrownBy(() -> sessions.create("call-1", "abc123", "", SessionPatch.empty()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldBecomeUnreadableAfterTtlWithoutUpdates() throws Exception {
        sessions.create("call-1", "abc123", "", SessionPatch.empty());

        clock.advance(TTL.minusSeconds(1));
        assertThat(sessions.get("call-1")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(sessions.get("call-1")).isEmpty();
        assertThat(sessions.update("call-1", SessionPatch.status(CallStatus.ACTIVE))).isFalse();
        assertThat(sessions.get("call-1")).isEmpty();
    }

    @Test
    void updateShouldNotCreateMissingSession() throws Exception {
        assertThat(sessions.update("ghost", SessionPatch.status(CallStatus.ACTIVE))).isFalse();
        assertThat(sessions.get("ghost")).isEmpty();
    }

    @Test
    void updateShouldRefreshTtlButNeverPastMaximumLifetime() throws Exception {
        sessions.create("call-1", "abc123", "", SessionPatch.empty());

        clock.advance(Duration.ofHours(10));
        assertThat(sessions.update("call-1", SessionPatch.status(CallStatus.ACTIVE))).isTrue();
        assertThat(kv.expiresAt("CALL_SESSION:call-1")).contains(Instant.parse("2026-04-03T19:00:00Z"));

        clock.advance(Duration.ofHours(40));
        assertThat(sessions.update("call-1", SessionPatch.empty().withAdversarialScore(2.0))).isTrue();
        assertThat(kv.expiresAt("CALL_SESSION:call-1")).contains(Instant.parse("2026-04-04T09:00:00Z"));

        clock.advance(Duration.ofHours(22));
        assertThat(sessions.update("call-1", SessionPatch.empty().withAdversarialScore(3.0))).isFalse();
        assertThat(sessions.get("call-1")).isEmpty();
    }

    @Test
    void shouldStampCompletionTimeWhenCompleted() throws Exception {
        sessions.create("call-1", "abc123", "", SessionPatch.status(CallStatus.ACTIVE));
        ConversationState finished = new ConversationState(ConversationStage.CLOSING, 5, List.of(),
            List.of(EmploymentFragment.job(List.of(2010, 2014), "Acme", "clerk", null)),
            List.of(), "", 0.95, true, "");
        clock.advance(Duration.ofMinutes(6));

        sessions.update("call-1", SessionPatch.status(CallStatus.COMPLETED).withConversationState(finished));

        CallSession loaded = sessions.get("call-1").orElseThrow();
        assertThat(loaded.completedAt()).isEqualTo(Instant.parse("2026-04-01T09:06:00Z"));
        assertThat(loaded.conversationState().fragments()).hasSize(1);
    }

    @Test
    void shouldRefuseCompletionWithoutReason() throws Exception {
        sessions.create("call-1", "abc123", "", SessionPatch.status(CallStatus.ACTIVE));

        assertThatThrownBy(() -> sessions.update("call-1", SessionPatch.status(CallStatus.COMPLETED)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldListOnlyActiveSessions() throws Exception {
        sessions.create("a", "h1", "", SessionPatch.status(CallStatus.ACTIVE));
        sessions.create("b", "h2", "", SessionPatch.empty());
        sessions.create("c", "h3", "", SessionPatch.status(CallStatus.ACTIVE));
        sessions.delete("c");

        assertThat(sessions.listActive()).extracting(CallSession::callId).containsExactly("a");
    }

    @Test
    void shouldRoundTripFieldsThroughSqlite() throws Exception {
        SessionStore durable = new SessionStore(
            new SqliteKeyValueStore(tempDir.resolve("state.db"), clock), TTL, MAX_LIFETIME, clock
        );
        durable.create("call-9", "ffee", "", SessionPatch.status(CallStatus.ACTIVE));
        durable.update("call-9", SessionPatch.empty().withExtractedFields(Map.of(
            "employer_name", List.of(new FieldValue("Acme", 0.9, clock.instant()))
        )));

        CallSession loaded = durable.get("call-9").orElseThrow();

        assertThat(loaded.values("employer_name")).extracting(FieldValue::value).containsExactly("Acme");
    }
}
