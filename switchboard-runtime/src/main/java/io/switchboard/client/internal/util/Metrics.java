/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.util;

import java.util.function.ToDoubleFunction;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import io.switchboard.client.internal.ConnectionState;

/**
 * Meter definitions shared by the session store and the connection state machine.
 */
public final class Metrics {

    public static final String SESSIONS_CREATED = "switchboard_sessions_created";
    public static final String SESSIONS_EVICTED = "switchboard_sessions_evicted";
    public static final String SESSIONS_REMOVED = "switchboard_sessions_removed";
    public static final String SESSIONS_LIVE = "switchboard_sessions_live";
    public static final String CONNECTION_TRANSITIONS = "switchboard_connection_transitions";

    public static final String REASON_LABEL = "reason";
    public static final String SCOPE_LABEL = "scope";
    public static final String STATE_LABEL = "state";

    /** Eviction picked a session that was neither connecting nor connected. */
    public static final String EVICTED_IDLE = "idle";
    /** Every session was connecting or connected, so the least recently used one was dropped. */
    public static final String EVICTED_ACTIVE = "active";

    public static final String SCOPE_SESSION = "session";
    public static final String SCOPE_CONNECTION = "connection";

    private Metrics() {
    }

    public static Counter sessionsCreatedCounter(MeterRegistry registry) {
        return Counter.builder(SESSIONS_CREATED)
                .description("Sessions created, excluding sessions restored from storage")
                .register(registry);
    }

    public static Counter sessionsEvictedCounter(MeterRegistry registry, String reason) {
        return Counter.builder(SESSIONS_EVICTED)
                .description("Sessions removed to make room for a new one")
                .tag(REASON_LABEL, reason)
                .register(registry);
    }

    public static Counter sessionsRemovedCounter(MeterRegistry registry) {
        return Counter.builder(SESSIONS_REMOVED)
                .description("Sessions removed for any reason, including eviction")
                .register(registry);
    }

    public static Counter connectionTransitionCounter(MeterRegistry registry, String scope, ConnectionState newState) {
        return Counter.builder(CONNECTION_TRANSITIONS)
                .description("Connection state updates by target state")
                .tag(SCOPE_LABEL, scope)
                .tag(STATE_LABEL, newState.name())
                .register(registry);
    }

    public static <T> void liveSessionsGauge(MeterRegistry registry, T owner, ToDoubleFunction<T> sessionCount) {
        Gauge.builder(SESSIONS_LIVE, owner, sessionCount)
                .description("Sessions currently held by the store")
                .register(registry);
    }
}
