/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.util.List;
import java.util.Objects;

import io.switchboard.client.internal.session.Session;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Result of {@link PersistenceAdapter#load()}. Every session is {@code Disconnected}.
 */
public record PersistedSessions(List<Session> sessions, @Nullable String activeId) {

    public static final PersistedSessions EMPTY = new PersistedSessions(List.of(), null);

    public PersistedSessions {
        sessions = List.copyOf(Objects.requireNonNull(sessions));
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }
}
