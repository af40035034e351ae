/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.switchboard.client.MutableClock;
import io.switchboard.client.internal.ConnectionState;
import io.switchboard.client.internal.persistence.InMemoryKeyValueStore;
import io.switchboard.client.internal.persistence.PersistenceAdapter;
import io.switchboard.client.internal.util.Metrics;

import edu.umd.cs.findbugs.annotations.Nullable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private MutableClock clock;
    private PersistenceAdapter persistence;
    private SimpleMeterRegistry registry;
    private SessionStore store;
    private RecordingListener events;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1L);
        persistence = new PersistenceAdapter(new InMemoryKeyValueStore(), 10, clock);
        registry = new SimpleMeterRegistry();
        store = newStore(SessionStore.DEFAULT_MAX_SESSIONS);
        events = new RecordingListener();
        store.addListener(events);
    }

    private SessionStore newStore(int maxSessions) {
        AtomicInteger ids = new AtomicInteger();
        return new SessionStore(maxSessions, clock, persistence, registry, () -> "s" + ids.incrementAndGet());
    }

    private Session createAt(long time, String url) {
        clock.set(time);
        return store.createSession(url);
    }

    // ==================== Creation ====================

    @Test
    void shouldCreateSessionAndMakeItActive() {
        Session session = createAt(10L, "https://a.com");

        assertThat(session.id()).isEqualTo("s1");
        assertThat(session.serverUrl()).isEqualTo("https://a.com");
        assertThat(session.displayName()).isEqualTo("a.com");
        assertThat(session.createdAt()).isEqualTo(10L);
        assertThat(session.lastActiveAt()).isEqualTo(10L);
        assertThat(session.connectionState()).isSameAs(ConnectionState.Disconnected.INSTANCE);
        assertThat(store.activeSession()).isSameAs(session);
        assertThat(events.events).containsExactly("created:s1", "active:s1");
    }

    @Test
    void shouldReturnExistingSessionForSameUrl() {
        Session first = createAt(1L, "https://a.com");
        createAt(2L, "https://b.com");
        events.events.clear();

        Session again = createAt(3L, "https://a.com");

        assertThat(again.id()).isEqualTo(first.id());
        assertThat(store.sessionCount()).isEqualTo(2);
        assertThat(store.activeSessionId()).isEqualTo(first.id());
        assertThat(events.events).containsExactly("active:s1");
    }

    @Test
    void shouldNotEmitWhenRecreatingActiveSession() {
        createAt(1L, "https://a.com");
        events.events.clear();

        store.createSession("https://a.com");

        assertThat(store.sessionCount()).isEqualTo(1);
        assertThat(events.events).isEmpty();
    }

    @Test
    void shouldNeverExceedCapacity() {
        for (int i = 0; i < 12; i++) {
            createAt(i, "https://host" + i + ".example.com");
            assertThat(store.sessionCount()).isLessThanOrEqualTo(SessionStore.DEFAULT_MAX_SESSIONS);
        }
        assertThat(store.sessions()).extracting(Session::serverUrl).containsExactly(
                "https://host7.example.com",
                "https://host8.example.com",
                "https://host9.example.com",
                "https://host10.example.com",
                "https://host11.example.com");
    }

    @Test
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> newStore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Eviction ====================

    @Test
    void shouldEvictLeastRecentlyActiveIdleSession() {
        Session a = createAt(1L, "https://a.com");
        Session b = createAt(2L, "https://b.com");
        store.updateSessionState(b.id(), ConnectionState.Connected.INSTANCE);
        createAt(3L, "https://c.com");
        createAt(4L, "https://d.com");
        createAt(5L, "https://e.com");
        events.events.clear();

        Session f = createAt(6L, "https://f.com");

        assertThat(store.getSession(a.id())).isNull();
        assertThat(store.getSession(b.id())).isNotNull();
        assertThat(store.sessionCount()).isEqualTo(5);
        assertThat(events.events).containsExactly("removed:" + a.id(), "created:" + f.id(), "active:" + f.id());
        assertThat(registry.get(Metrics.SESSIONS_EVICTED).tag(Metrics.REASON_LABEL, Metrics.EVICTED_IDLE).counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldHandOverToNewSessionWhenActiveOneIsEvicted() {
        Session s1 = createAt(1L, "https://a.com");
        List<Session> others = new ArrayList<>();
        for (int i = 2; i <= 5; i++) {
            others.add(createAt(i, "https://host" + i + ".com"));
        }
        clock.set(6L);
        store.setActiveSession(s1.id());
        clock.set(7L);
        others.forEach(session -> store.updateSessionState(session.id(), ConnectionState.Connected.INSTANCE));
        events.events.clear();

        Session s6 = createAt(8L, "https://f.com");

        assertThat(store.getSession(s1.id())).isNull();
        assertThat(store.activeSession()).isSameAs(s6);
        assertThat(persistence.load().activeId()).isEqualTo(s6.id());
        assertThat(events.events).containsExactly("removed:" + s1.id(), "created:" + s6.id(), "active:" + s6.id());
    }

    @Test
    void shouldPreferIdleSessionOverLessRecentConnectedOne() {
        Session a = createAt(1L, "https://a.com");
        store.updateSessionState(a.id(), ConnectionState.Connected.INSTANCE);
        Session b = createAt(2L, "https://b.com");
        createAt(3L, "https://c.com");
        createAt(4L, "https://d.com");
        createAt(5L, "https://e.com");

        createAt(6L, "https://f.com");

        assertThat(store.getSession(a.id())).isNotNull();
        assertThat(store.getSession(b.id())).isNull();
    }

    @Test
    void shouldEvictLeastRecentlyActiveWhenAllAreActive() {
        for (int i = 1; i <= 5; i++) {
            Session session = createAt(i, "https://host" + i + ".com");
            store.updateSessionState(session.id(), ConnectionState.Connecting.INSTANCE);
        }
        assertThat(store.canCreateNewSession()).isFalse();
        assertThat(store.getActiveSessionCount()).isEqualTo(5);

        createAt(10L, "https://host6.com");

        assertThat(store.getSessionByUrl("https://host1.com")).isNull();
        assertThat(store.sessionCount()).isEqualTo(5);
        assertThat(registry.get(Metrics.SESSIONS_EVICTED).tag(Metrics.REASON_LABEL, Metrics.EVICTED_ACTIVE).counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldBreakActivityTiesByInsertionOrder() {
        clock.set(7L);
        for (int i = 1; i <= 5; i++) {
            store.createSession("https://host" + i + ".com");
        }

        store.createSession("https://host6.com");

        assertThat(store.getSessionByUrl("https://host1.com")).isNull();
        assertThat(store.getSessionByUrl("https://host2.com")).isNotNull();
    }

    @Test
    void shouldBreakActivityTiesByCreationTime() {
        persistence.persist(List.of(
                Session.restore("x", "https://x.com", "x.com", 20L, 50L),
                Session.restore("y", "https://y.com", "y.com", 10L, 50L),
                Session.restore("z", "https://z.com", "z.com", 30L, 60L),
                Session.restore("v", "https://v.com", "v.com", 30L, 70L),
                Session.restore("w", "https://w.com", "w.com", 30L, 80L)), "w");
        store.restore();

        createAt(100L, "https://new.com");

        assertThat(store.sessions()).extracting(Session::id).containsExactly("x", "z", "v", "w", "s1");
    }

    // ==================== Active Pointer ====================

    @Test
    void shouldTouchBothSessionsWhenSwitching() {
        Session a = createAt(1L, "https://a.com");
        Session b = createAt(2L, "https://b.com");
        events.events.clear();
        clock.set(9L);

        assertThat(store.setActiveSession(a.id())).isTrue();

        assertThat(store.activeSession()).isSameAs(a);
        assertThat(a.lastActiveAt()).isEqualTo(9L);
        assertThat(b.lastActiveAt()).isEqualTo(9L);
        assertThat(events.events).containsExactly("active:" + a.id());
    }

    @Test
    void shouldIgnoreSwitchToUnknownOrActiveSession() {
        Session a = createAt(1L, "https://a.com");
        events.events.clear();
        clock.set(5L);

        assertThat(store.setActiveSession(a.id())).isFalse();
        assertThat(store.setActiveSession("missing")).isFalse();

        assertThat(a.lastActiveAt()).isEqualTo(1L);
        assertThat(events.events).isEmpty();
    }

    @Test
    void shouldActivateMostRecentlyActiveSessionOnRemoval() {
        Session a = createAt(1L, "https://a.com");
        Session b = createAt(2L, "https://b.com");
        Session c = createAt(3L, "https://c.com");
        store.updateSessionState(a.id(), ConnectionState.Connected.INSTANCE);
        events.events.clear();

        store.removeSession(c.id());

        assertThat(store.activeSession()).isSameAs(a);
        assertThat(store.getSession(b.id())).isNotNull();
        assertThat(events.events).containsExactly("removed:" + c.id(), "active:" + a.id());
    }

    @Test
    void shouldPreferMostRecentlyCreatedOnActivityTie() {
        persistence.persist(List.of(
                Session.restore("p", "https://p.com", "p.com", 5L, 10L),
                Session.restore("q", "https://q.com", "q.com", 1L, 10L),
                Session.restore("r", "https://r.com", "r.com", 2L, 3L)), "r");
        store.restore();

        store.removeSession("r");

        assertThat(store.activeSessionId()).isEqualTo("p");
    }

    @Test
    void shouldPreferLaterInsertedOnCompleteTie() {
        clock.set(4L);
        Session a = store.createSession("https://a.com");
        Session b = store.createSession("https://b.com");
        Session c = store.createSession("https://c.com");
        store.setActiveSession(a.id());

        // b and c tie on activity and creation time
        store.removeSession(a.id());

        assertThat(store.activeSession()).isSameAs(c);
        assertThat(store.getSession(b.id())).isNotNull();
    }

    @Test
    void shouldNotChangeActiveWhenRemovingOtherSession() {
        Session a = createAt(1L, "https://a.com");
        Session b = createAt(2L, "https://b.com");
        events.events.clear();

        assertThat(store.removeSession(a.id())).isTrue();

        assertThat(store.activeSession()).isSameAs(b);
        assertThat(events.events).containsExactly("removed:" + a.id());
    }

    @Test
    void shouldClearActiveWhenLastSessionRemoved() {
        Session a = createAt(1L, "https://a.com");
        events.events.clear();

        store.removeSession(a.id());

        assertThat(store.activeSession()).isNull();
        assertThat(store.activeSessionId()).isNull();
        assertThat(events.events).containsExactly("removed:" + a.id(), "active:null");
        assertThat(store.removeSession(a.id())).isFalse();
    }

    @Test
    void shouldKeepActivePointerValidThroughAnySequence() {
        String[] urls = { "https://a.com", "https://b.com", "https://c.com", "https://d.com", "https://e.com", "https://f.com", "https://g.com" };
        for (int step = 0; step < 60; step++) {
            clock.set(step);
            String url = urls[(step * 5) % urls.length];
            if (step % 3 == 2) {
                Session victim = store.getSessionByUrl(url);
                if (victim != null) {
                    store.removeSession(victim.id());
                }
            }
            else {
                store.createSession(url);
            }
            String activeId = store.activeSessionId();
            assertThat(activeId == null || store.getSession(activeId) != null).isTrue();
            assertThat(activeId == null).isEqualTo(store.sessionCount() == 0);
        }
    }

    // ==================== State, Rename, Bulk Removal ====================

    @Test
    void shouldUpdateStateAndTouchSession() {
        Session a = createAt(1L, "https://a.com");
        events.events.clear();
        clock.set(8L);

        assertThat(store.updateSessionState(a.id(), new ConnectionState.Error("timeout"))).isTrue();

        assertThat(store.activeSession().connectionState()).isEqualTo(new ConnectionState.Error("timeout"));
        assertThat(a.hasError()).isTrue();
        assertThat(a.errorMessage()).isEqualTo("timeout");
        assertThat(a.lastActiveAt()).isEqualTo(8L);
        assertThat(events.events).containsExactly("state:" + a.id() + ":Disconnected->Error");
    }

    @Test
    void shouldIgnoreStateOfUnknownSession() {
        assertThat(store.updateSessionState("missing", ConnectionState.Connected.INSTANCE)).isFalse();
        assertThat(events.events).isEmpty();
    }

    @Test
    void shouldRenameAndRevertSession() {
        Session a = createAt(1L, "https://chat.example.com");

        assertThat(store.renameSession(a.id(), "  Work  ")).isTrue();
        assertThat(a.displayName()).isEqualTo("Work");
        assertThat(persistence.load().sessions().get(0).displayName()).isEqualTo("Work");

        store.renameSession(a.id(), " ");
        assertThat(a.displayName()).isEqualTo("example.com");
        assertThat(events.events).endsWith("renamed:" + a.id(), "renamed:" + a.id());
        assertThat(store.renameSession("missing", "x")).isFalse();
    }

    @Test
    void shouldRemoveAllSessions() {
        Session a = createAt(1L, "https://a.com");
        Session b = createAt(2L, "https://b.com");
        events.events.clear();

        store.removeAllSessions();

        assertThat(store.sessions()).isEmpty();
        assertThat(store.activeSession()).isNull();
        assertThat(events.events).containsExactly("removed:" + a.id(), "removed:" + b.id(), "active:null");
        assertThat(persistence.load().isEmpty()).isTrue();
    }

    // ==================== Persistence and Restore ====================

    @Test
    void shouldMirrorChangesToPersistence() {
        Session a = createAt(1L, "https://a.com");
        createAt(2L, "https://b.com");
        store.setActiveSession(a.id());

        SessionStore restored = newStore(SessionStore.DEFAULT_MAX_SESSIONS);
        assertThat(restored.restore()).isEqualTo(2);

        assertThat(restored.sessions()).extracting(Session::serverUrl).containsExactly("https://a.com", "https://b.com");
        assertThat(restored.activeSessionId()).isEqualTo(a.id());
    }

    @Test
    void shouldRestoreSessionsDisconnected() {
        Session a = createAt(1L, "https://a.com");
        store.updateSessionState(a.id(), ConnectionState.Connected.INSTANCE);

        SessionStore restored = newStore(SessionStore.DEFAULT_MAX_SESSIONS);
        restored.restore();

        assertThat(restored.getSession(a.id()).connectionState()).isSameAs(ConnectionState.Disconnected.INSTANCE);
    }

    @Test
    void shouldRestoreMostRecentlyActiveWhenPersistedActiveIsMissing() {
        persistence.persist(List.of(
                Session.restore("old", "https://old.com", "old.com", 1L, 5L),
                Session.restore("new", "https://new.com", "new.com", 2L, 9L)), "gone");

        store.restore();

        assertThat(store.activeSessionId()).isEqualTo("new");
    }

    @Test
    void shouldKeepMostRecentlyActiveSessionsBeyondCapacity() {
        persistence.persist(List.of(
                Session.restore("a", "https://a.com", "a.com", 1L, 30L),
                Session.restore("b", "https://b.com", "b.com", 2L, 10L),
                Session.restore("c", "https://c.com", "c.com", 3L, 20L)), "b");
        SessionStore small = newStore(2);

        small.restore();

        assertThat(small.sessions()).extracting(Session::id).containsExactly("a", "c");
        assertThat(small.activeSessionId()).isEqualTo("a");
    }

    @Test
    void shouldDropRenderStatesOfSessionsNotRestored() {
        persistence.persist(List.of(
                Session.restore("a", "https://a.com", "a.com", 1L, 30L),
                Session.restore("b", "https://b.com", "b.com", 2L, 10L)), "a");
        persistence.saveRenderState("a", new byte[]{ 1 });
        persistence.saveRenderState("b", new byte[]{ 2 });
        persistence.saveRenderState("orphan", new byte[]{ 3 });
        SessionStore small = newStore(1);

        small.restore();

        assertThat(persistence.loadRenderState("a")).containsExactly(1);
        assertThat(persistence.loadRenderState("b")).isNull();
        assertThat(persistence.loadRenderState("orphan")).isNull();
        assertThat(persistence.load().sessions()).extracting(Session::id).containsExactly("a");
    }

    @Test
    void shouldRefuseToRestoreIntoPopulatedStore() {
        createAt(1L, "https://a.com");

        assertThatThrownBy(() -> store.restore()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRestoreNothingFromEmptyStorage() {
        assertThat(store.restore()).isZero();
        assertThat(store.activeSession()).isNull();
    }

    // ==================== End to End ====================

    @Test
    void shouldEmitRemovalThenActivationWhenActiveSessionClosed() {
        Session s1 = createAt(100L, "https://a.com");
        assertThat(store.activeSessionId()).isEqualTo(s1.id());

        Session s2 = createAt(200L, "https://b.com");
        assertThat(store.activeSessionId()).isEqualTo(s2.id());
        assertThat(store.getSession(s1.id())).isNotNull();

        clock.set(300L);
        store.setActiveSession(s1.id());
        assertThat(store.activeSessionId()).isEqualTo(s1.id());

        clock.set(400L);
        store.updateSessionState(s2.id(), new ConnectionState.Error("timeout"));
        events.events.clear();

        store.removeSession(s1.id());

        assertThat(store.activeSession()).isSameAs(s2);
        assertThat(store.sessions()).containsExactly(s2);
        assertThat(events.events).containsExactly("removed:" + s1.id(), "active:" + s2.id());
    }

    // ==================== Listeners and Metrics ====================

    @Test
    void shouldDeliverToRemainingListenersWhenOneThrows() {
        SessionListener failing = new SessionListener() {
            @Override
            public void onSessionCreated(Session session) {
                throw new IllegalStateException("listener bug");
            }
        };
        RecordingListener late = new RecordingListener();
        store.addListener(failing);
        store.addListener(late);

        Session a = createAt(1L, "https://a.com");

        assertThat(late.events).containsExactly("created:" + a.id(), "active:" + a.id());
        assertThat(store.getSession(a.id())).isNotNull();
    }

    @Test
    void shouldStopDeliveringToRemovedListener() {
        store.removeListener(events);

        createAt(1L, "https://a.com");

        assertThat(events.events).isEmpty();
    }

    @Test
    void shouldCountSessions() {
        for (int i = 0; i < 7; i++) {
            createAt(i, "https://host" + i + ".com");
        }
        store.removeSession(store.activeSessionId());

        assertThat(registry.get(Metrics.SESSIONS_CREATED).counter().count()).isEqualTo(7.0);
        assertThat(registry.get(Metrics.SESSIONS_REMOVED).counter().count()).isEqualTo(3.0);
        assertThat(registry.get(Metrics.SESSIONS_LIVE).gauge().value()).isEqualTo(4.0);
    }

    private static class RecordingListener implements SessionListener {
        private final List<String> events = new ArrayList<>();

        @Override
        public void onSessionCreated(Session session) {
            events.add("created:" + session.id());
        }

        @Override
        public void onSessionRemoved(Session session) {
            events.add("removed:" + session.id());
        }

        @Override
        public void onSessionStateChanged(Session session, ConnectionState oldState, ConnectionState newState) {
            events.add("state:" + session.id() + ":" + oldState.name() + "->" + newState.name());
        }

        @Override
        public void onActiveSessionChanged(@Nullable Session session) {
            events.add("active:" + (session == null ? null : session.id()));
        }

        @Override
        public void onSessionRenamed(Session session) {
            events.add("renamed:" + session.id());
        }
    }
}
