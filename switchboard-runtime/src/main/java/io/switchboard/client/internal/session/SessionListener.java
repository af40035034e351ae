/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.session;

import io.switchboard.client.internal.ConnectionState;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Receives session store events. Callbacks run synchronously on the thread that mutated the
 * store, in listener registration order, before the mutating call returns.
 * <p>
 * Implementations must not call back into the store.
 * </p>
 */
public interface SessionListener {

    default void onSessionCreated(Session session) {
    }

    /**
     * Called for explicit removals and for sessions evicted to make room.
     */
    default void onSessionRemoved(Session session) {
    }

    default void onSessionStateChanged(Session session, ConnectionState oldState, ConnectionState newState) {
    }

    /**
     * @param session the new active session, or null when the last session was removed
     */
    default void onActiveSessionChanged(@Nullable Session session) {
    }

    default void onSessionRenamed(Session session) {
    }
}
