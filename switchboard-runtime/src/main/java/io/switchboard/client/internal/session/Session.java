/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.session;

import java.util.Objects;

import io.switchboard.client.internal.ConnectionState;
import io.switchboard.client.internal.net.DisplayNames;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A logical connection to one server.
 *
 * <p>Identity, url and creation time are fixed for the lifetime of the session; a different url
 * always means a different session. Connection state and activity time are only ever changed by
 * the {@link SessionStore}, the render state by the store and the {@link RenderStateBridge}.</p>
 */
public final class Session {

    private final String id;
    private final String serverUrl;
    private final long createdAt;

    // Mutable state
    private volatile String displayName;
    private volatile ConnectionState connectionState = ConnectionState.Disconnected.INSTANCE;
    private volatile long lastActiveAt;
    private volatile @Nullable byte[] renderState;

    Session(String id, String serverUrl, String displayName, long createdAt, long lastActiveAt) {
        this.id = Objects.requireNonNull(id);
        this.serverUrl = Objects.requireNonNull(serverUrl);
        this.displayName = Objects.requireNonNull(displayName);
        this.createdAt = createdAt;
        this.lastActiveAt = Math.max(createdAt, lastActiveAt);
    }

    static Session create(String id, String serverUrl, long now) {
        return new Session(id, serverUrl, DisplayNames.fromUrl(serverUrl), now, now);
    }

    /**
     * Rebuilds a session from its persisted metadata. Connection state is never persisted, so the
     * result is always {@link ConnectionState.Disconnected}.
     */
    public static Session restore(String id, String serverUrl, String displayName, long createdAt, long lastActiveAt) {
        return new Session(id, serverUrl, displayName, createdAt, lastActiveAt);
    }

    // ==================== Accessors ====================

    public String id() {
        return id;
    }

    public String serverUrl() {
        return serverUrl;
    }

    public String displayName() {
        return displayName;
    }

    public ConnectionState connectionState() {
        return connectionState;
    }

    public long createdAt() {
        return createdAt;
    }

    public long lastActiveAt() {
        return lastActiveAt;
    }

    /**
     * @return a copy of the last saved render state, or null if none was saved
     */
    @Nullable
    public byte[] renderState() {
        byte[] state = renderState;
        return state == null ? null : state.clone();
    }

    public boolean hasRenderState() {
        return renderState != null;
    }

    public boolean isConnected() {
        return connectionState instanceof ConnectionState.Connected;
    }

    public boolean isConnecting() {
        return connectionState instanceof ConnectionState.Connecting;
    }

    public boolean hasError() {
        return connectionState instanceof ConnectionState.Error;
    }

    @Nullable
    public String errorMessage() {
        return connectionState instanceof ConnectionState.Error error ? error.message() : null;
    }

    // ==================== Mutators (store and bridge only) ====================

    void setConnectionState(ConnectionState connectionState) {
        this.connectionState = Objects.requireNonNull(connectionState);
    }

    void setDisplayName(String displayName) {
        this.displayName = Objects.requireNonNull(displayName);
    }

    void setRenderState(@Nullable byte[] renderState) {
        this.renderState = renderState == null ? null : renderState.clone();
    }

    /**
     * Moves the activity time forward. A clock that steps backwards never moves it back.
     */
    void touch(long now) {
        if (now > lastActiveAt) {
            lastActiveAt = now;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Session other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        byte[] state = renderState;
        return "Session{" +
                "id='" + id + '\'' +
                ", serverUrl='" + serverUrl + '\'' +
                ", displayName='" + displayName + '\'' +
                ", connectionState=" + connectionState +
                ", createdAt=" + createdAt +
                ", lastActiveAt=" + lastActiveAt +
                ", renderState=" + (state != null ? state.length + " bytes" : "none") +
                '}';
    }
}
