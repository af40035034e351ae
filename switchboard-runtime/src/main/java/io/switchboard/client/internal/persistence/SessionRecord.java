/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.util.Objects;

import io.switchboard.client.internal.session.Session;

/**
 * The durable subset of a {@link Session}. Connection state and render state are deliberately absent.
 */
public record SessionRecord(String id, String serverUrl, String displayName, long createdAt, long lastActiveAt) {

    public SessionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(displayName, "displayName");
    }

    public static SessionRecord from(Session session) {
        return new SessionRecord(
                session.id(),
                session.serverUrl(),
                session.displayName(),
                session.createdAt(),
                session.lastActiveAt());
    }

    public Session toSession() {
        return Session.restore(id, serverUrl, displayName, createdAt, lastActiveAt);
    }
}
