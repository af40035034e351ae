/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.switchboard.client.config.SwitchboardConfig;
import io.switchboard.client.internal.ConnectionState;
import io.switchboard.client.internal.ConnectionStateListener;
import io.switchboard.client.internal.ConnectionStateMachine;
import io.switchboard.client.internal.net.UrlNormalizer;
import io.switchboard.client.internal.net.UrlValidation;
import io.switchboard.client.internal.persistence.FileKeyValueStore;
import io.switchboard.client.internal.persistence.InMemoryKeyValueStore;
import io.switchboard.client.internal.persistence.PersistenceAdapter;
import io.switchboard.client.internal.persistence.RecentServerEntry;
import io.switchboard.client.internal.session.RenderStateBridge;
import io.switchboard.client.internal.session.Session;
import io.switchboard.client.internal.session.SessionListener;
import io.switchboard.client.internal.session.SessionStore;
import io.switchboard.client.service.KeyValueStore;
import io.switchboard.client.service.NetworkReachability;
import io.switchboard.client.service.RenderSurface;
import io.switchboard.client.service.RenderSurfaceListener;
import io.switchboard.client.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Entry point of the library. Wires the session store, connection state machine, persistence
 * and render-state bridge once, and coordinates them on behalf of the host application.
 *
 * <p>The host registers the switchboard as the {@link RenderSurfaceListener} of its rendering
 * surface. Page callbacks are applied to the active session in both the connection state machine
 * and the session store.</p>
 *
 * <h2>Switching</h2>
 * <p>Every change of displayed session goes through {@link #switchToSession(String)} or
 * {@link #connect(String)}, which capture the render state of the outgoing session before the
 * incoming session is restored or loaded.</p>
 *
 * <p>Network availability is never polled: the host reports changes through
 * {@link #onNetworkAvailabilityChanged(boolean)}.</p>
 */
public class Switchboard implements RenderSurfaceListener {

    static final String NETWORK_UNAVAILABLE = "Network unavailable";
    static final String BLANK_PAGE = "about:blank";

    private static final Logger LOGGER = LoggerFactory.getLogger(Switchboard.class);

    private final SessionStore sessionStore;
    private final ConnectionStateMachine connectionStateMachine;
    private final PersistenceAdapter persistence;
    private final RenderStateBridge renderStateBridge;
    private final RenderSurface surface;
    private final NetworkReachability reachability;

    @VisibleForTesting
    Switchboard(SessionStore sessionStore,
                ConnectionStateMachine connectionStateMachine,
                PersistenceAdapter persistence,
                RenderStateBridge renderStateBridge,
                RenderSurface surface,
                NetworkReachability reachability) {
        this.sessionStore = Objects.requireNonNull(sessionStore);
        this.connectionStateMachine = Objects.requireNonNull(connectionStateMachine);
        this.persistence = Objects.requireNonNull(persistence);
        this.renderStateBridge = Objects.requireNonNull(renderStateBridge);
        this.surface = Objects.requireNonNull(surface);
        this.reachability = Objects.requireNonNull(reachability);
    }

    // ==================== Construction ====================

    /**
     * Creates a switchboard backed by the store named in the configuration, or an in-memory
     * store if none is configured.
     */
    public static Switchboard create(SwitchboardConfig config, RenderSurface surface, NetworkReachability reachability) {
        KeyValueStore store = config.storeFile() != null ? new FileKeyValueStore(config.storeFile()) : new InMemoryKeyValueStore();
        return create(config, store, surface, reachability);
    }

    public static Switchboard create(SwitchboardConfig config, KeyValueStore store, RenderSurface surface, NetworkReachability reachability) {
        return create(config, store, surface, reachability, Clock.systemUTC(), new SimpleMeterRegistry());
    }

    /**
     * Wires the components and restores the sessions persisted by a previous run. Restored
     * sessions are disconnected; nothing is loaded into the surface until the host asks.
     */
    public static Switchboard create(SwitchboardConfig config,
                                     KeyValueStore store,
                                     RenderSurface surface,
                                     NetworkReachability reachability,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        Objects.requireNonNull(config, "config");
        PersistenceAdapter persistence = new PersistenceAdapter(store, config.maxRecentServers(), clock);
        persistence.migrateLegacyHistory();

        SessionStore sessionStore = new SessionStore(config.maxSessions(), clock, persistence, meterRegistry);
        sessionStore.restore();

        RenderStateBridge bridge = new RenderStateBridge(sessionStore, config.persistRenderState() ? persistence : null);
        sessionStore.addListener(bridge);

        ConnectionStateMachine connectionStateMachine = new ConnectionStateMachine(persistence, meterRegistry);
        LOGGER.debug("Switchboard created with {} restored sessions, {}", sessionStore.sessionCount(), config);
        return new Switchboard(sessionStore, connectionStateMachine, persistence, bridge, surface, reachability);
    }

    // ==================== Connecting ====================

    public UrlValidation validate(@Nullable String input) {
        return UrlNormalizer.validate(input);
    }

    /**
     * Validates {@code input} and, if it is acceptable, shows a session for it and starts loading
     * it. Connecting to a url that already has a session reuses that session.
     *
     * @return the validation result; nothing happens when it is invalid
     */
    public synchronized UrlValidation connect(@Nullable String input) {
        UrlValidation validation = UrlNormalizer.validate(input);
        if (validation instanceof UrlValidation.Valid valid) {
            Session existing = sessionStore.getSessionByUrl(valid.url());
            if (existing == null || !existing.equals(sessionStore.activeSession())) {
                saveActiveRenderState();
            }
            connectToServer(valid.url());
        }
        else {
            LOGGER.debug("Rejected server url: {}", validation);
        }
        return validation;
    }

    /**
     * Retries the active session, or the last attempted url if there is no session. When the
     * network is unavailable the active session is marked failed instead.
     *
     * @return true if a connection attempt was started
     */
    public synchronized boolean reconnectActiveSession() {
        Session active = sessionStore.activeSession();
        if (!reachability.isOnline()) {
            if (active != null) {
                markFailed(active, NETWORK_UNAVAILABLE);
            }
            return false;
        }
        if (active != null) {
            connectToServer(active.serverUrl());
            return true;
        }
        String url = connectionStateMachine.currentServerUrl();
        if (url != null) {
            connectToServer(url);
            return true;
        }
        return false;
    }

    /**
     * Applies a change of network availability reported by the host. Losing the network marks
     * the active session failed. Regaining it reconnects a failed active session when
     * auto-reconnect is enabled.
     */
    public synchronized void onNetworkAvailabilityChanged(boolean online) {
        Session active = sessionStore.activeSession();
        if (active == null) {
            return;
        }
        if (!online) {
            LOGGER.info("{}: Network lost", active.id());
            markFailed(active, NETWORK_UNAVAILABLE);
        }
        else if (active.hasError() && persistence.autoReconnect()) {
            LOGGER.info("{}: Network available, reconnecting to {}", active.id(), active.serverUrl());
            connectToServer(active.serverUrl());
        }
    }

    private void connectToServer(String url) {
        String displayedId = connectionStateMachine.currentSessionId();
        Session session = sessionStore.createSession(url);
        if (displayedId != null && sessionStore.getSession(displayedId) == null) {
            LOGGER.debug("{}: Displayed session was evicted", displayedId);
            connectionStateMachine.onDisconnected(displayedId);
        }
        LOGGER.info("{}: Connecting to {}", session.id(), url);
        connectionStateMachine.onConnectionStarted(url, session.id());
        sessionStore.updateSessionState(session.id(), ConnectionState.Connecting.INSTANCE);
        surface.load(url);
    }

    private void markFailed(Session session, String message) {
        connectionStateMachine.onConnectionFailed(message, session.id());
        sessionStore.updateSessionState(session.id(), new ConnectionState.Error(message));
    }

    // ==================== Switching and Closing ====================

    /**
     * Displays another live session. The outgoing session's render state is captured first, then
     * the incoming session's saved state is restored, or its url loaded if it has none.
     *
     * @return false if the session is unknown or already displayed
     */
    public synchronized boolean switchToSession(String sessionId) {
        Session target = sessionStore.getSession(sessionId);
        if (target == null || target.equals(sessionStore.activeSession())) {
            return false;
        }
        saveActiveRenderState();
        sessionStore.setActiveSession(sessionId);
        show(target);
        return true;
    }

    /**
     * Closes a session. If it was displayed, the session that becomes active is shown, or a
     * blank page when no session remains.
     *
     * @return false if the session is unknown
     */
    public synchronized boolean closeSession(String sessionId) {
        boolean wasActive = sessionId.equals(sessionStore.activeSessionId());
        if (!sessionStore.removeSession(sessionId)) {
            return false;
        }
        if (wasActive) {
            connectionStateMachine.onDisconnected(sessionId);
            showActiveOrBlank();
        }
        return true;
    }

    public synchronized void closeAllSessions() {
        sessionStore.removeAllSessions();
        connectionStateMachine.onDisconnected();
        surface.load(BLANK_PAGE);
    }

    /**
     * Captures the render state of the displayed session, typically when the host is backgrounded.
     */
    public synchronized void saveActiveRenderState() {
        Session active = sessionStore.activeSession();
        if (active != null) {
            renderStateBridge.saveState(active.id(), surface.captureState());
        }
    }

    private void showActiveOrBlank() {
        Session next = sessionStore.activeSession();
        if (next != null) {
            show(next);
        }
        else {
            surface.load(BLANK_PAGE);
        }
    }

    private void show(Session session) {
        byte[] renderState = renderStateBridge.loadState(session.id());
        if (renderState != null) {
            LOGGER.debug("{}: Restoring {} bytes of render state", session.id(), renderState.length);
            surface.restoreState(renderState);
        }
        else {
            surface.load(session.serverUrl());
        }
        connectionStateMachine.switchToSession(session.id(), session.serverUrl());
    }

    // ==================== Rendering Surface Callbacks ====================

    @Override
    public synchronized void onPageStarted(@Nullable String url) {
        Session active = sessionStore.activeSession();
        if (active != null) {
            connectionStateMachine.onConnectionStarted(active.serverUrl(), active.id());
            sessionStore.updateSessionState(active.id(), ConnectionState.Connecting.INSTANCE);
        }
        else if (url != null) {
            connectionStateMachine.onConnectionStarted(url);
        }
    }

    /**
     * Marks the active session connected. History records the session's own url rather than
     * {@code url}, which may be a page reached by redirect or navigation.
     */
    @Override
    public synchronized void onPageFinished(@Nullable String url) {
        Session active = sessionStore.activeSession();
        if (active != null) {
            connectionStateMachine.onConnectionSuccess(active.serverUrl(), active.id());
            sessionStore.updateSessionState(active.id(), ConnectionState.Connected.INSTANCE);
        }
        else if (url != null && !url.isBlank()) {
            connectionStateMachine.onConnectionSuccess(url);
        }
    }

    @Override
    public synchronized void onError(String message) {
        Session active = sessionStore.activeSession();
        if (active != null) {
            markFailed(active, message);
        }
        else {
            connectionStateMachine.onConnectionFailed(message);
        }
    }

    @Override
    public void onSslError(String message) {
        onError(message);
    }

    // ==================== Read Side ====================

    public List<Session> sessions() {
        return sessionStore.sessions();
    }

    @Nullable
    public Session activeSession() {
        return sessionStore.activeSession();
    }

    @Nullable
    public Session getSession(String sessionId) {
        return sessionStore.getSession(sessionId);
    }

    public boolean canCreateNewSession() {
        return sessionStore.canCreateNewSession();
    }

    public int getActiveSessionCount() {
        return sessionStore.getActiveSessionCount();
    }

    public ConnectionState connectionState() {
        return connectionStateMachine.state();
    }

    public List<RecentServerEntry> recentServers() {
        return connectionStateMachine.recentServers();
    }

    @Nullable
    public String lastServerUrl() {
        return connectionStateMachine.lastServerUrl();
    }

    // ==================== History and Preferences ====================

    public boolean renameSession(String sessionId, @Nullable String displayName) {
        return sessionStore.renameSession(sessionId, displayName);
    }

    public void removeRecentServer(String url) {
        persistence.removeRecentUrl(url);
    }

    public boolean renameRecentServer(String url, @Nullable String name) {
        return persistence.renameRecentServer(url, name);
    }

    /**
     * Forgets the recent-server history and persisted session data. Live sessions stay open and
     * are persisted again on their next change.
     */
    public void clearHistory() {
        connectionStateMachine.clearHistory();
    }

    public boolean autoReconnect() {
        return persistence.autoReconnect();
    }

    public void setAutoReconnect(boolean autoReconnect) {
        persistence.setAutoReconnect(autoReconnect);
    }

    // ==================== Listeners ====================

    public void addSessionListener(SessionListener listener) {
        sessionStore.addListener(listener);
    }

    public void removeSessionListener(SessionListener listener) {
        sessionStore.removeListener(listener);
    }

    public void addConnectionStateListener(ConnectionStateListener listener) {
        connectionStateMachine.addListener(listener);
    }

    public void removeConnectionStateListener(ConnectionStateListener listener) {
        connectionStateMachine.removeListener(listener);
    }

    @Override
    public String toString() {
        return "Switchboard{" +
                "sessionStore=" + sessionStore +
                ", connectionStateMachine=" + connectionStateMachine +
                '}';
    }
}
