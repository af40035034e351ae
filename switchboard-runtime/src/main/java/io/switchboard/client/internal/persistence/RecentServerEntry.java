/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A server the user has connected to. History entries outlive the sessions that created them.
 *
 * @param url the server url, unique within the history
 * @param name optional user chosen name
 * @param lastConnected epoch millis of the last successful connection, 0 if never connected
 * @param createdAt epoch millis when the entry was first recorded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecentServerEntry(String url, @Nullable String name, long lastConnected, long createdAt) {

    public RecentServerEntry {
        Objects.requireNonNull(url, "url");
    }

    public static RecentServerEntry of(String url, long now) {
        return new RecentServerEntry(url, null, now, now);
    }

    public RecentServerEntry withLastConnected(long timestamp) {
        return new RecentServerEntry(url, name, timestamp, createdAt);
    }

    public RecentServerEntry withName(@Nullable String newName) {
        return new RecentServerEntry(url, newName == null || newName.isBlank() ? null : newName.trim(), lastConnected, createdAt);
    }

    /**
     * @return the user chosen name, falling back to the url's host, or the url itself
     */
    @JsonIgnore
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        try {
            String host = new URI(url).getHost();
            return host != null ? host : url;
        }
        catch (URISyntaxException e) {
            return url;
        }
    }
}
