/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Everything the session store persists, written as a single record so that the session list and
 * the active pointer can never be observed out of step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreRecord(List<SessionRecord> sessions, @Nullable String activeId) {

    public StoreRecord {
        sessions = List.copyOf(Objects.requireNonNull(sessions, "sessions"));
    }
}
