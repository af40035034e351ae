/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Receives every transition made by a {@link ConnectionStateMachine}, including
 * transitions to the state it is already in.
 */
public interface ConnectionStateListener {

    /**
     * @param oldState state before the call
     * @param newState state after the call
     * @param sessionId the session the transition was reported for, or null for the legacy single-connection calls
     */
    void onConnectionStateChanged(ConnectionState oldState, ConnectionState newState, @Nullable String sessionId);

    /**
     * Called when the displayed session changes.
     */
    default void onSessionSwitched(String sessionId, String url) {
    }
}
