/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;

import io.switchboard.client.internal.persistence.PersistenceAdapter;
import io.switchboard.client.internal.persistence.RecentServerEntry;
import io.switchboard.client.internal.util.Metrics;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Tracks the lifecycle of the current connection attempt, which is the connection of the
 * displayed session.
 *
 * <p>The machine is a ledger of what the rendering surface reports. Every report is recorded and
 * broadcast to {@link ConnectionStateListener}s, including one that repeats the current state or
 * one that falls outside the lifecycle documented on {@link ConnectionState}; the latter is only
 * logged. Keeping the per-session state in the session store in step with this machine is the
 * caller's responsibility.</p>
 *
 * <p>A successful connection is recorded in the recent-server history.</p>
 */
public class ConnectionStateMachine {

    static final String DEFAULT_FAILURE_MESSAGE = "Connection failed";

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionStateMachine.class);

    private final PersistenceAdapter persistence;
    private final MeterRegistry meterRegistry;
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * The current state. This can be changed via a call to one of the {@code on*()} methods.
     */
    private volatile ConnectionState state = ConnectionState.Disconnected.INSTANCE;

    private volatile @Nullable String currentServerUrl;
    private volatile @Nullable String currentSessionId;

    public ConnectionStateMachine(PersistenceAdapter persistence, MeterRegistry meterRegistry) {
        this.persistence = Objects.requireNonNull(persistence);
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    // ==================== Accessors ====================

    public ConnectionState state() {
        return state;
    }

    @Nullable
    public String currentServerUrl() {
        return currentServerUrl;
    }

    @Nullable
    public String currentSessionId() {
        return currentSessionId;
    }

    @Nullable
    public String lastServerUrl() {
        return persistence.lastServerUrl();
    }

    public List<RecentServerEntry> recentServers() {
        return persistence.recentServers();
    }

    public List<String> recentUrls() {
        return persistence.recentUrls();
    }

    /**
     * Forgets every previously connected server. Live sessions are not affected.
     */
    public void clearHistory() {
        persistence.clearHistory();
    }

    // ==================== Transitions ====================

    public void onConnectionStarted(String url) {
        onConnectionStarted(url, null);
    }

    /**
     * The rendering surface started loading {@code url}.
     */
    public synchronized void onConnectionStarted(String url, @Nullable String sessionId) {
        Objects.requireNonNull(url, "url");
        currentServerUrl = url;
        if (sessionId != null) {
            currentSessionId = sessionId;
        }
        updateState(ConnectionState.Connecting.INSTANCE, sessionId);
    }

    public void onConnectionSuccess(String url) {
        onConnectionSuccess(url, null);
    }

    /**
     * The rendering surface finished loading {@code url}, which is added to the recent history.
     */
    public synchronized void onConnectionSuccess(String url, @Nullable String sessionId) {
        Objects.requireNonNull(url, "url");
        currentServerUrl = url;
        persistence.addRecentUrl(url);
        updateState(ConnectionState.Connected.INSTANCE, sessionId);
    }

    public void onConnectionFailed(@Nullable String message) {
        onConnectionFailed(message, null);
    }

    /**
     * @param message user-facing failure text, {@value #DEFAULT_FAILURE_MESSAGE} when null
     */
    public synchronized void onConnectionFailed(@Nullable String message, @Nullable String sessionId) {
        updateState(new ConnectionState.Error(message != null ? message : DEFAULT_FAILURE_MESSAGE), sessionId);
    }

    public void onDisconnected() {
        onDisconnected(null);
    }

    public synchronized void onDisconnected(@Nullable String sessionId) {
        updateState(ConnectionState.Disconnected.INSTANCE, sessionId);
        if (sessionId != null && sessionId.equals(currentSessionId)) {
            currentSessionId = null;
        }
    }

    /**
     * Records that the displayed session is now {@code sessionId}. The connection state is
     * left as it is.
     */
    public synchronized void switchToSession(String sessionId, String url) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(url, "url");
        currentSessionId = sessionId;
        currentServerUrl = url;
        LOGGER.debug("{}: Switched to {}", sessionId, url);
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onSessionSwitched(sessionId, url);
            }
            catch (RuntimeException e) {
                LOGGER.warn("{}: Connection listener {} failed: {}", sessionId, listener, e.getMessage(), e);
            }
        }
    }

    // ==================== Listeners ====================

    public void addListener(ConnectionStateListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    // ==================== Internals ====================

    private void updateState(ConnectionState newState, @Nullable String sessionId) {
        ConnectionState oldState = state;
        if (!oldState.canTransitionTo(newState)) {
            LOGGER.debug("{}: Unexpected transition {} -> {}, recording anyway", sessionId, oldState.name(), newState.name());
        }
        state = newState;
        Metrics.connectionTransitionCounter(meterRegistry, Metrics.SCOPE_CONNECTION, newState).increment();
        LOGGER.trace("{}: {} -> {}", sessionId, oldState.name(), newState.name());

        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onConnectionStateChanged(oldState, newState, sessionId);
            }
            catch (RuntimeException e) {
                LOGGER.warn("{}: Connection listener {} failed: {}", sessionId, listener, e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectionStateMachine{" +
                "state=" + state +
                ", currentServerUrl=" + currentServerUrl +
                ", currentSessionId=" + currentSessionId +
                '}';
    }
}
