/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.config;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Switchboard settings.
 *
 * <pre>
 * maxSessions: 5              # live sessions before the least recently used is evicted
 * maxRecentServers: 10        # entries kept in the recent-server history
 * persistRenderState: false   # write captured render state through to the store
 * storeFile: /var/lib/app/switchboard.properties   # omit for an in-memory store
 * </pre>
 *
 * @param maxSessions maximum number of live sessions, at least 1
 * @param maxRecentServers maximum length of the recent-server history, at least 1
 * @param persistRenderState whether render state survives a restart
 * @param storeFile properties file backing the store, or null to keep everything in memory
 */
public record SwitchboardConfig(int maxSessions,
                                int maxRecentServers,
                                boolean persistRenderState,
                                @Nullable Path storeFile) {

    public static final int DEFAULT_MAX_SESSIONS = 5;
    public static final int DEFAULT_MAX_RECENT_SERVERS = 10;

    public SwitchboardConfig {
        if (maxSessions < 1) {
            throw new IllegalConfigurationException("maxSessions must be at least 1, was " + maxSessions);
        }
        if (maxRecentServers < 1) {
            throw new IllegalConfigurationException("maxRecentServers must be at least 1, was " + maxRecentServers);
        }
    }

    @JsonCreator
    public static SwitchboardConfig fromJson(@JsonProperty("maxSessions") @Nullable Integer maxSessions,
                                      @JsonProperty("maxRecentServers") @Nullable Integer maxRecentServers,
                                      @JsonProperty("persistRenderState") @Nullable Boolean persistRenderState,
                                      @JsonProperty("storeFile") @Nullable String storeFile) {
        return new SwitchboardConfig(
                maxSessions != null ? maxSessions : DEFAULT_MAX_SESSIONS,
                maxRecentServers != null ? maxRecentServers : DEFAULT_MAX_RECENT_SERVERS,
                persistRenderState != null && persistRenderState,
                storeFile != null && !storeFile.isBlank() ? Path.of(storeFile) : null);
    }

    public static SwitchboardConfig defaults() {
        return new SwitchboardConfig(DEFAULT_MAX_SESSIONS, DEFAULT_MAX_RECENT_SERVERS, false, null);
    }

    public SwitchboardConfig withStoreFile(@Nullable Path storeFile) {
        return new SwitchboardConfig(maxSessions, maxRecentServers, persistRenderState, storeFile);
    }

    public SwitchboardConfig withPersistRenderState(boolean persistRenderState) {
        return new SwitchboardConfig(maxSessions, maxRecentServers, persistRenderState, storeFile);
    }
}
