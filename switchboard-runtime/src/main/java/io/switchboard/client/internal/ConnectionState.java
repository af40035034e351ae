/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal;

import java.util.Objects;

/**
 * Sealed hierarchy representing the connection state of a server session.
 * The same states are tracked per session by the session store and for the
 * single current connection by the {@link ConnectionStateMachine}.
 *
 * <pre>
 *   Disconnected ◄──────────────────────┐
 *      │                                │ onDisconnected()
 *      ▼ onConnectionStarted()          │
 *   Connecting ◄────────────────────────┤
 *      │                                │ retry
 *      ├──────────────► Error(message) ─┤
 *      │                                │
 *      ▼ onConnectionSuccess()          │
 *   Connected ──────────────────────────┘
 * </pre>
 */
public sealed interface ConnectionState permits
        ConnectionState.Disconnected,
        ConnectionState.Connecting,
        ConnectionState.Connected,
        ConnectionState.Error {

    /**
     * Initial state, and the state of every session restored from storage.
     */
    record Disconnected() implements ConnectionState {
        public static final Disconnected INSTANCE = new Disconnected();
    }

    /**
     * The rendering surface has started loading the server.
     */
    record Connecting() implements ConnectionState {
        public static final Connecting INSTANCE = new Connecting();
    }

    /**
     * The server's page finished loading.
     */
    record Connected() implements ConnectionState {
        public static final Connected INSTANCE = new Connected();
    }

    /**
     * The connection attempt failed. The message is opaque user-facing text.
     */
    record Error(String message) implements ConnectionState {
        public Error {
            Objects.requireNonNull(message);
        }
    }

    /**
     * @return true when a connection is being attempted or is established
     */
    default boolean isActive() {
        return this instanceof Connecting || this instanceof Connected;
    }

    default boolean isConnected() {
        return this instanceof Connected;
    }

    /**
     * Whether moving from this state to {@code next} follows the documented lifecycle.
     * Re-entering the same state is always allowed.
     */
    default boolean canTransitionTo(ConnectionState next) {
        if (this.getClass() == next.getClass()) {
            return true;
        }
        if (this instanceof Disconnected) {
            return next instanceof Connecting;
        }
        if (this instanceof Connecting) {
            return next instanceof Connected || next instanceof Error || next instanceof Disconnected;
        }
        // Connected and Error
        return next instanceof Connecting || next instanceof Disconnected;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
