package com.demoBank.chatbox.session;

import com.demoBank.chatbox.message.SenderType;
import com.demoBank.chatbox.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private static final Duration TTL = Duration.ofMinutes(15);
    private static final Duration GRACE = Duration.ofMinutes(15);

    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        registry = new SessionRegistry(TTL, GRACE, Duration.ofMinutes(5), clock);
    }

    @AfterEach
    void tearDown() {
        registry.stop();
    }

    @Test
    @DisplayName("Missing or unknown session id creates a new session with a server id")
    void getOrCreate_unknownId_createsNew() {
        ChatSession fromNull = registry.getOrCreateSession(null, "user-1");
        ChatSession fromUnknown = registry.getOrCreateSession("does-not-exist", "user-1");

        assertThat(fromNull.getId()).isNotBlank();
        assertThat(fromUnknown.getId()).isNotEqualTo("does-not-exist").isNotEqualTo(fromNull.getId());
        assertThat(fromUnknown.getUserId()).isEqualTo("user-1");
        assertThat(fromUnknown.isActive()).isTrue();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Owner gets the same session object back")
    void getOrCreate_existing_returnsSameObject() {
        ChatSession session = registry.createSession("user-1");

        assertThat(registry.getOrCreateSession(session.getId(), "user-1")).isSameAs(session);
    }

    @Test
    @DisplayName("Another user cannot resume the session and it is left untouched")
    void getOrCreate_otherOwner_throwsAndDoesNotMutate() {
        ChatSession session = registry.createSession("user-1");
        Instant lastActivity = session.getLastActivity();
        clock.advance(Duration.ofMinutes(1));

        assertThatThrownBy(() -> registry.getOrCreateSession(session.getId(), "user-2"))
                .isInstanceOf(SessionOwnershipException.class);

        assertThat(session.getLastActivity()).isEqualTo(lastActivity);
        assertThat(session.getUserId()).isEqualTo("user-1");
    }

    @Test
    @DisplayName("Ended session is restored within the reconnect grace window")
    void getOrCreate_withinGrace_restores() {
        ChatSession session = registry.createSession("user-1");
        registry.endSession(session.getId());
        clock.advance(GRACE.minusSeconds(1));

        ChatSession restored = registry.getOrCreateSession(session.getId(), "user-1");

        assertThat(restored).isSameAs(session);
        assertThat(restored.isActive()).isTrue();
        assertThat(restored.getEndTime()).isNull();
    }

    @Test
    @DisplayName("Ended session past the grace window is replaced by a new one")
    void getOrCreate_pastGrace_createsNew() {
        ChatSession session = registry.createSession("user-1");
        registry.endSession(session.getId());
        clock.advance(GRACE.plusSeconds(1));

        ChatSession replacement = registry.getOrCreateSession(session.getId(), "user-1");

        assertThat(replacement.getId()).isNotEqualTo(session.getId());
        assertThat(registry.getSession(session.getId())).isEmpty();
    }

    @Test
    @DisplayName("Ending a session twice keeps the first end time")
    void endSession_isIdempotent() {
        ChatSession session = registry.createSession("user-1");
        Instant firstEnd = clock.instant();

        assertThat(registry.endSession(session.getId())).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(registry.endSession(session.getId())).isFalse();

        assertThat(session.getEndTime()).isEqualTo(firstEnd);
        assertThat(session.isActive()).isFalse();
    }

    @Test
    @DisplayName("Ending an unknown session fails")
    void endSession_unknown_throws() {
        assertThatThrownBy(() -> registry.endSession("missing"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("Session is named after its first message only")
    void setSessionName_onlyOnce() {
        ChatSession session = registry.createSession("user-1");

        registry.setSessionNameFromMessage(session.getId(), "Lost card. Please help");
        registry.setSessionNameFromMessage(session.getId(), "Something else");

        assertThat(session.getName()).isEqualTo("Lost card.");
    }

    @Test
    @DisplayName("Messages, tokens and response times show up in the summary")
    void summary_reflectsRecordedActivity() {
        ChatSession session = registry.createSession("user-1");
        registry.recordMessage(session.getId(), SessionMessage.builder()
                .id("m1").content("hi").sender(SenderType.USER).timestamp(clock.instant()).build());
        registry.recordTokenUsage(session.getId(), 40);
        registry.recordTokenUsage(session.getId(), 0);
        registry.recordResponseTime(session.getId(), Duration.ofMillis(100));
        registry.recordResponseTime(session.getId(), Duration.ofMillis(300));

        SessionSummary summary = registry.snapshot(session.getId()).orElseThrow();

        assertThat(summary.getMessageCount()).isEqualTo(1);
        assertThat(summary.getTotalTokens()).isEqualTo(40);
        assertThat(summary.getAverageResponseTimeMs()).isEqualTo(200);
        assertThat(summary.getMaxResponseTimeMs()).isEqualTo(300);
    }

    @Test
    @DisplayName("Only one of two concurrent takeovers succeeds")
    void setAdminAssistance_concurrent_oneWinner() throws Exception {
        ChatSession session = registry.createSession("user-1");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Boolean> first = pool.submit(takeover(start, session.getId(), "admin-1"));
            Future<Boolean> second = pool.submit(takeover(start, session.getId(), "admin-2"));
            start.countDown();

            boolean firstWon = first.get(5, TimeUnit.SECONDS);
            boolean secondWon = second.get(5, TimeUnit.SECONDS);

            assertThat(firstWon ^ secondWon).isTrue();
            String winner = firstWon ? "admin-1" : "admin-2";
            assertThat(session.getAssistingAdminId()).isEqualTo(winner);
            assertThat(session.isAdminAssisted()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Repeat takeover by the same admin is a conflict")
    void setAdminAssistance_sameAdminTwice_conflict() {
        ChatSession session = registry.createSession("user-1");
        registry.setAdminAssistance(session.getId(), "admin-1", "Alex");

        assertThatThrownBy(() -> registry.setAdminAssistance(session.getId(), "admin-1", "Alex"))
                .isInstanceOf(AdminAssistanceConflictException.class);
    }

    @Test
    @DisplayName("Only the assisting admin can release the session")
    void clearAdminAssistance_otherAdmin_conflict() {
        ChatSession session = registry.createSession("user-1");
        registry.setAdminAssistance(session.getId(), "admin-1", "Alex");

        assertThatThrownBy(() -> registry.clearAdminAssistance(session.getId(), "admin-2"))
                .isInstanceOf(AdminAssistanceConflictException.class);

        SessionSummary released = registry.clearAdminAssistance(session.getId(), "admin-1");
        assertThat(released.isAdminAssisted()).isFalse();
        assertThat(released.getAssistingAdminId()).isNull();
    }

    @Test
    @DisplayName("Takeover of an unknown session fails with not found")
    void setAdminAssistance_unknown_notFound() {
        assertThatThrownBy(() -> registry.setAdminAssistance("missing", "admin-1", "Alex"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("Last connection detaching ends the session")
    void detachConnection_lastOne_endsSession() {
        ChatSession session = registry.createSession("user-1");
        registry.attachConnection(session.getId());
        registry.attachConnection(session.getId());

        assertThat(registry.detachConnection(session.getId())).isFalse();
        assertThat(session.isActive()).isTrue();
        assertThat(registry.detachConnection(session.getId())).isTrue();
        assertThat(session.isActive()).isFalse();
        assertThat(session.getConnectionCount()).isZero();
    }

    @Test
    @DisplayName("Sweep removes idle sessions but keeps connected ones")
    void sweep_removesIdleOnly() {
        ChatSession idle = registry.createSession("user-1");
        ChatSession connected = registry.createSession("user-2");
        registry.attachConnection(connected.getId());
        clock.advance(TTL.plusMinutes(1));
        ChatSession fresh = registry.createSession("user-3");

        int removed = registry.sweep();

        assertThat(removed).isEqualTo(1);
        assertThat(registry.getSession(idle.getId())).isEmpty();
        assertThat(registry.getSession(connected.getId())).isPresent();
        assertThat(registry.getSession(fresh.getId())).isPresent();
    }

    @Test
    @DisplayName("Sessions are listed newest first")
    void listSessions_newestFirst() {
        ChatSession older = registry.createSession("user-1");
        clock.advance(Duration.ofSeconds(5));
        ChatSession newer = registry.createSession("user-2");

        List<SessionSummary> sessions = registry.listSessions();

        assertThat(sessions).extracting(SessionSummary::getSessionId)
                .containsExactly(newer.getId(), older.getId());
    }

    @Test
    @DisplayName("Stopping twice is a no-op")
    void stop_twice_noop() {
        registry.start();
        assertThat(registry.isRunning()).isTrue();

        registry.stop();
        registry.stop();

        assertThat(registry.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Start after stop leaves the sweep off")
    void start_afterStop_doesNothing() {
        registry.stop();

        registry.start();

        assertThat(registry.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Counters track created, ended and active sessions")
    void counters_trackLifecycle() {
        ChatSession first = registry.createSession("user-1");
        registry.createSession("user-2");
        registry.attachConnection(first.getId());

        registry.detachConnection(first.getId());

        assertThat(registry.createdCount()).isEqualTo(2);
        assertThat(registry.endedCount()).isEqualTo(1);
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    private Callable<Boolean> takeover(CountDownLatch start, String sessionId, String adminId) {
        return () -> {
            start.await();
            try {
                registry.setAdminAssistance(sessionId, adminId, adminId);
                return true;
            } catch (AdminAssistanceConflictException e) {
                return false;
            }
        };
    }
}
