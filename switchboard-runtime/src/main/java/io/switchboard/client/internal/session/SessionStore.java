/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import io.switchboard.client.internal.ConnectionState;
import io.switchboard.client.internal.net.DisplayNames;
import io.switchboard.client.internal.persistence.PersistedSessions;
import io.switchboard.client.internal.persistence.PersistenceAdapter;
import io.switchboard.client.internal.util.Metrics;
import io.switchboard.client.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The authoritative set of live sessions and the pointer to the one being displayed.
 *
 * <p>This class is the only place where session membership, connection state and activity time
 * change. It provides:</p>
 * <ul>
 *   <li>Idempotent creation: one live session per server url</li>
 *   <li>Capacity enforcement by eviction, never by refusing a new session</li>
 *   <li>Active session switching</li>
 *   <li>Mirroring of every change to the {@link PersistenceAdapter}</li>
 *   <li>Synchronous, ordered fan-out of {@link SessionListener} events</li>
 * </ul>
 *
 * <h2>Eviction</h2>
 * <p>When a session is created at capacity, the victim is the least recently active session that
 * is neither connecting nor connected. If every session is connecting or connected, the least
 * recently active session is evicted regardless. Ordering is by {@code lastActiveAt}, then
 * {@code createdAt}, then insertion order, all ascending. An eviction is reported only as
 * {@code SessionRemoved}, followed by the new session's {@code SessionCreated} and
 * {@code ActiveSessionChanged}.</p>
 *
 * <h2>Threading</h2>
 * <p>All mutating operations are synchronized, so a transition and its events are never observed
 * half applied. Listeners are invoked while the lock is held and must not call back into the
 * store.</p>
 *
 * <pre>
 *   Switchboard
 *       │
 *       ▼
 *   SessionStore ──► PersistenceAdapter ──► KeyValueStore
 *       │
 *     ┌─┴──────┬────────┐
 *     ▼        ▼        ▼
 *   Session₁ Session₂ … Sessionₙ   (n ≤ maxSessions)
 * </pre>
 */
public class SessionStore {

    public static final int DEFAULT_MAX_SESSIONS = 5;

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStore.class);

    @VisibleForTesting
    static final Comparator<Session> EVICTION_ORDER = Comparator.comparingLong(Session::lastActiveAt)
            .thenComparingLong(Session::createdAt);

    private final int maxSessions;
    private final Clock clock;
    private final PersistenceAdapter persistence;
    private final Supplier<String> idGenerator;

    // Live sessions, in creation order
    private final List<Session> sessions = new ArrayList<>();
    private volatile @Nullable Session activeSession;

    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    // Metrics
    private final MeterRegistry meterRegistry;
    private final Counter createdCounter;
    private final Counter removedCounter;
    private final Counter evictedIdleCounter;
    private final Counter evictedActiveCounter;

    public SessionStore(int maxSessions, Clock clock, PersistenceAdapter persistence, MeterRegistry meterRegistry) {
        this(maxSessions, clock, persistence, meterRegistry, () -> UUID.randomUUID().toString());
    }

    @VisibleForTesting
    SessionStore(int maxSessions, Clock clock, PersistenceAdapter persistence, MeterRegistry meterRegistry, Supplier<String> idGenerator) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1, was " + maxSessions);
        }
        this.maxSessions = maxSessions;
        this.clock = Objects.requireNonNull(clock);
        this.persistence = Objects.requireNonNull(persistence);
        this.idGenerator = Objects.requireNonNull(idGenerator);
        this.meterRegistry = Objects.requireNonNull(meterRegistry);

        this.createdCounter = Metrics.sessionsCreatedCounter(meterRegistry);
        this.removedCounter = Metrics.sessionsRemovedCounter(meterRegistry);
        this.evictedIdleCounter = Metrics.sessionsEvictedCounter(meterRegistry, Metrics.EVICTED_IDLE);
        this.evictedActiveCounter = Metrics.sessionsEvictedCounter(meterRegistry, Metrics.EVICTED_ACTIVE);
        Metrics.liveSessionsGauge(meterRegistry, this, SessionStore::sessionCount);
    }

    // ==================== Accessors ====================

    public int maxSessions() {
        return maxSessions;
    }

    /**
     * @return a snapshot of the live sessions in creation order
     */
    public synchronized List<Session> sessions() {
        return List.copyOf(sessions);
    }

    public synchronized int sessionCount() {
        return sessions.size();
    }

    /**
     * The returned instance is live: later state changes made by the store are visible through it.
     *
     * @return the displayed session, or null if there is none
     */
    @Nullable
    public Session activeSession() {
        return activeSession;
    }

    @Nullable
    public String activeSessionId() {
        Session active = activeSession;
        return active == null ? null : active.id();
    }

    @Nullable
    public synchronized Session getSession(String sessionId) {
        return find(sessionId);
    }

    @Nullable
    public synchronized Session getSessionByUrl(String serverUrl) {
        return sessions.stream()
                .filter(s -> s.serverUrl().equals(serverUrl))
                .findFirst()
                .orElse(null);
    }

    /**
     * @return the number of sessions that are connecting or connected
     */
    public synchronized int getActiveSessionCount() {
        return (int) sessions.stream()
                .filter(s -> s.connectionState().isActive())
                .count();
    }

    /**
     * @return true if a session can be created without evicting one that is connecting or connected
     */
    public synchronized boolean canCreateNewSession() {
        return sessions.size() < maxSessions
                || sessions.stream().anyMatch(s -> !s.connectionState().isActive());
    }

    // ==================== Lifecycle ====================

    /**
     * Rehydrates the store from persisted metadata. Restored sessions are disconnected. The active
     * session is the persisted one if it survived, otherwise the most recently active session.
     *
     * @return the number of sessions restored
     * @throws IllegalStateException if the store already holds sessions
     */
    public synchronized int restore() {
        if (!sessions.isEmpty()) {
            throw new IllegalStateException("Cannot restore into a store holding " + sessions.size() + " sessions");
        }
        PersistedSessions persisted = persistence.load();
        List<Session> restored = new ArrayList<>(persisted.sessions());
        if (restored.size() > maxSessions) {
            LOGGER.info("Restoring the {} most recently active of {} persisted sessions", maxSessions, restored.size());
            List<Session> keep = restored.stream()
                    .sorted(EVICTION_ORDER.reversed())
                    .limit(maxSessions)
                    .toList();
            restored.retainAll(keep);
        }
        sessions.addAll(restored);

        String activeId = persisted.activeId();
        Session active = activeId != null ? find(activeId) : null;
        activeSession = active != null ? active : mostRecentlyActive().orElse(null);

        if (sessions.size() < persisted.sessions().size()) {
            persist();
        }
        persistence.retainRenderStates(sessions.stream().map(Session::id).toList());

        if (!sessions.isEmpty()) {
            LOGGER.info("Restored {} sessions, active session {}", sessions.size(), activeSessionId());
        }
        return sessions.size();
    }

    /**
     * Returns the live session for {@code serverUrl}, activating it, or creates one. At capacity
     * a session is evicted first (see class documentation). A new session becomes the active one.
     *
     * @param serverUrl canonical server url
     * @return the existing or new session
     */
    public synchronized Session createSession(String serverUrl) {
        Objects.requireNonNull(serverUrl, "serverUrl");

        Session existing = getSessionByUrl(serverUrl);
        if (existing != null) {
            LOGGER.debug("{}: Reusing session for {}", existing.id(), serverUrl);
            setActiveSession(existing.id());
            return existing;
        }

        while (sessions.size() >= maxSessions) {
            evictOne();
        }

        Session session = Session.create(idGenerator.get(), serverUrl, clock.millis());
        sessions.add(session);
        activeSession = session;
        createdCounter.increment();
        persist();

        LOGGER.debug("{}: Session created for {} as '{}' ({} of {})",
                session.id(), serverUrl, session.displayName(), sessions.size(), maxSessions);

        fire(listener -> listener.onSessionCreated(session));
        fire(listener -> listener.onActiveSessionChanged(session));
        return session;
    }

    /**
     * Makes the session the displayed one, marking both it and the previously active session as
     * used now.
     *
     * @return false if the session is unknown or already active
     */
    public synchronized boolean setActiveSession(String sessionId) {
        Session session = find(sessionId);
        Session previous = activeSession;
        if (session == null || session.equals(previous)) {
            return false;
        }

        long now = clock.millis();
        if (previous != null) {
            previous.touch(now);
        }
        session.touch(now);
        activeSession = session;
        persist();

        LOGGER.debug("{}: Active session changed from {}", sessionId, previous != null ? previous.id() : null);

        fire(listener -> listener.onActiveSessionChanged(session));
        return true;
    }

    /**
     * Records a connection state reported for the session. Every call is broadcast, including one
     * that repeats the current state.
     *
     * @return false if the session is unknown
     */
    public synchronized boolean updateSessionState(String sessionId, ConnectionState newState) {
        Objects.requireNonNull(newState, "newState");
        Session session = find(sessionId);
        if (session == null) {
            LOGGER.debug("{}: Ignoring state {} for unknown session", sessionId, newState.name());
            return false;
        }

        ConnectionState oldState = session.connectionState();
        session.setConnectionState(newState);
        session.touch(clock.millis());
        // activeSession holds this same instance, so readers of the active session see the change
        Metrics.connectionTransitionCounter(meterRegistry, Metrics.SCOPE_SESSION, newState).increment();
        persist();

        LOGGER.trace("{}: State {} -> {}", sessionId, oldState.name(), newState.name());

        fire(listener -> listener.onSessionStateChanged(session, oldState, newState));
        return true;
    }

    /**
     * Overrides the session's display name. A null or blank name restores the name derived from
     * the url.
     *
     * @return false if the session is unknown
     */
    public synchronized boolean renameSession(String sessionId, @Nullable String displayName) {
        Session session = find(sessionId);
        if (session == null) {
            return false;
        }
        String name = displayName == null || displayName.isBlank()
                ? DisplayNames.fromUrl(session.serverUrl())
                : displayName.trim();
        session.setDisplayName(name);
        persist();

        LOGGER.debug("{}: Renamed to '{}'", sessionId, name);

        fire(listener -> listener.onSessionRenamed(session));
        return true;
    }

    /**
     * Removes the session. If it was active, the remaining session with the latest activity time
     * becomes active, or none if the store is now empty.
     *
     * @return false if the session is unknown
     */
    public synchronized boolean removeSession(String sessionId) {
        Session session = find(sessionId);
        if (session == null) {
            return false;
        }

        sessions.remove(session);
        removedCounter.increment();

        boolean activeChanged = session.equals(activeSession);
        if (activeChanged) {
            activeSession = mostRecentlyActive().orElse(null);
        }
        Session nextActive = activeSession;
        persist();

        LOGGER.debug("{}: Session removed ({} remaining)", sessionId, sessions.size());

        fire(listener -> listener.onSessionRemoved(session));
        if (activeChanged) {
            fire(listener -> listener.onActiveSessionChanged(nextActive));
        }
        return true;
    }

    /**
     * Removes every session. Persisted history is not touched.
     */
    public synchronized void removeAllSessions() {
        List<Session> removed = List.copyOf(sessions);
        boolean hadActive = activeSession != null;
        sessions.clear();
        activeSession = null;
        removedCounter.increment(removed.size());
        persist();

        LOGGER.debug("Removed all {} sessions", removed.size());

        for (Session session : removed) {
            fire(listener -> listener.onSessionRemoved(session));
        }
        if (hadActive) {
            fire(listener -> listener.onActiveSessionChanged(null));
        }
    }

    // ==================== Render State ====================

    /**
     * Stores the render state blob on the session entity.
     *
     * @return false if the session is unknown
     */
    synchronized boolean attachRenderState(String sessionId, @Nullable byte[] renderState) {
        Session session = find(sessionId);
        if (session == null) {
            return false;
        }
        session.setRenderState(renderState);
        return true;
    }

    // ==================== Listeners ====================

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ==================== Internals ====================

    private void evictOne() {
        Optional<Session> victim = sessions.stream()
                .filter(s -> !s.connectionState().isActive())
                .min(EVICTION_ORDER);
        Counter counter = evictedIdleCounter;
        if (victim.isEmpty()) {
            victim = sessions.stream().min(EVICTION_ORDER);
            counter = evictedActiveCounter;
        }

        Session session = victim.orElseThrow(() -> new IllegalStateException("No session to evict"));
        LOGGER.info("{}: Evicting session for {} (state {}, last active {}) to stay within {} sessions",
                session.id(), session.serverUrl(), session.connectionState().name(), session.lastActiveAt(), maxSessions);
        counter.increment();
        sessions.remove(session);
        removedCounter.increment();
        if (session.equals(activeSession)) {
            // the session about to be created takes over
            activeSession = null;
        }
        fire(listener -> listener.onSessionRemoved(session));
    }

    private Optional<Session> mostRecentlyActive() {
        // on a complete tie the later inserted session wins
        Session best = null;
        for (Session session : sessions) {
            if (best == null || EVICTION_ORDER.compare(session, best) >= 0) {
                best = session;
            }
        }
        return Optional.ofNullable(best);
    }

    @Nullable
    private Session find(String sessionId) {
        for (Session session : sessions) {
            if (session.id().equals(sessionId)) {
                return session;
            }
        }
        return null;
    }

    private void persist() {
        persistence.persist(sessions, activeSessionId());
    }

    private void fire(Consumer<SessionListener> event) {
        // CopyOnWriteArrayList iterates over a snapshot, listeners may (un)register during dispatch
        for (SessionListener listener : listeners) {
            try {
                event.accept(listener);
            }
            catch (RuntimeException e) {
                LOGGER.warn("Session listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    @Override
    public synchronized String toString() {
        return "SessionStore{" +
                "sessions=" + sessions.size() +
                ", maxSessions=" + maxSessions +
                ", activeSession=" + activeSessionId() +
                ", listeners=" + listeners.size() +
                '}';
    }
}
