/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.switchboard.client.internal.session.Session;
import io.switchboard.client.service.KeyValueStore;
import io.switchboard.client.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Maps the session store's durable fields and the connection history onto a {@link KeyValueStore}.
 *
 * <h2>Keys</h2>
 * <table>
 *   <tr><th>Key</th><th>Contents</th></tr>
 *   <tr><td>{@value #KEY_SESSION_STORE}</td><td>{@link StoreRecord} as JSON</td></tr>
 *   <tr><td>{@value #KEY_RECENT_SERVERS}</td><td>list of {@link RecentServerEntry}, most recent first</td></tr>
 *   <tr><td>{@value #KEY_LAST_SERVER_URL}</td><td>url of the last successful connection</td></tr>
 *   <tr><td>{@value #KEY_RENDER_STATES}</td><td>session id to Base64 render state, only when write-through is enabled</td></tr>
 *   <tr><td>{@value #KEY_AUTO_RECONNECT}</td><td>user preference, {@code true} or {@code false}</td></tr>
 *   <tr><td>{@value #KEY_LEGACY_RECENT_URLS}</td><td>pipe separated urls written by older releases, read by {@link #migrateLegacyHistory()}</td></tr>
 * </table>
 *
 * <h2>Failure handling</h2>
 * <p>A record that is missing or cannot be parsed reads as empty. A store that fails to write is
 * logged and otherwise ignored: losing history is preferable to failing the user's action.</p>
 */
public class PersistenceAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PersistenceAdapter.class);

    @VisibleForTesting
    static final String KEY_SESSION_STORE = "session_store_json";
    @VisibleForTesting
    static final String KEY_RECENT_SERVERS = "recent_servers_json";
    @VisibleForTesting
    static final String KEY_LAST_SERVER_URL = "last_server_url";
    @VisibleForTesting
    static final String KEY_RENDER_STATES = "render_states_json";
    @VisibleForTesting
    static final String KEY_AUTO_RECONNECT = "auto_reconnect";
    @VisibleForTesting
    static final String KEY_LEGACY_RECENT_URLS = "recent_urls";

    private static final Pattern LEGACY_URL_SEPARATOR = Pattern.compile("\\|");
    private static final TypeReference<List<RecentServerEntry>> RECENT_SERVERS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> RENDER_STATES_TYPE = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final int maxRecentServers;
    private final Clock clock;
    private final ObjectMapper mapper;

    public PersistenceAdapter(KeyValueStore store, int maxRecentServers, Clock clock) {
        if (maxRecentServers < 1) {
            throw new IllegalArgumentException("maxRecentServers must be at least 1, was " + maxRecentServers);
        }
        this.store = Objects.requireNonNull(store);
        this.maxRecentServers = maxRecentServers;
        this.clock = Objects.requireNonNull(clock);
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ==================== Session Metadata ====================

    /**
     * Replaces the persisted session list and active pointer.
     */
    public synchronized void persist(Collection<Session> sessions, @Nullable String activeId) {
        List<SessionRecord> records = sessions.stream()
                .map(SessionRecord::from)
                .toList();
        writeJson(KEY_SESSION_STORE, new StoreRecord(records, activeId));
        LOGGER.trace("Persisted {} sessions, active={}", records.size(), activeId);
    }

    /**
     * @return the persisted sessions, all {@code Disconnected}; empty if nothing usable was stored
     */
    public synchronized PersistedSessions load() {
        Optional<StoreRecord> record = readJson(KEY_SESSION_STORE, StoreRecord.class);
        if (record.isEmpty()) {
            return PersistedSessions.EMPTY;
        }
        Set<String> seenUrls = new LinkedHashSet<>();
        List<Session> sessions = new ArrayList<>();
        for (SessionRecord sessionRecord : record.get().sessions()) {
            if (!seenUrls.add(sessionRecord.serverUrl())) {
                LOGGER.warn("{}: Dropping persisted session with duplicate url {}", sessionRecord.id(), sessionRecord.serverUrl());
                continue;
            }
            sessions.add(sessionRecord.toSession());
        }
        String activeId = record.get().activeId();
        LOGGER.debug("Loaded {} persisted sessions, active={}", sessions.size(), activeId);
        return new PersistedSessions(sessions, activeId);
    }

    public synchronized void clearSessions() {
        remove(KEY_SESSION_STORE);
    }

    // ==================== Recent History ====================

    /**
     * @return the history, most recently connected first
     */
    public synchronized List<RecentServerEntry> recentServers() {
        return readJson(KEY_RECENT_SERVERS, RECENT_SERVERS_TYPE)
                .map(entries -> entries.stream().filter(Objects::nonNull).toList())
                .orElse(List.of());
    }

    public synchronized List<String> recentUrls() {
        return recentServers().stream().map(RecentServerEntry::url).toList();
    }

    public synchronized Optional<RecentServerEntry> recentServer(String url) {
        return recentServers().stream().filter(e -> e.url().equals(url)).findFirst();
    }

    /**
     * Records a connection to {@code url}. An existing entry is moved to the front and keeps its
     * name and creation time; the oldest entries beyond the limit are dropped.
     */
    public synchronized void addRecentUrl(String url) {
        Objects.requireNonNull(url);
        long now = clock.millis();
        List<RecentServerEntry> entries = new ArrayList<>(recentServers());
        RecentServerEntry entry = RecentServerEntry.of(url, now);
        for (var it = entries.iterator(); it.hasNext();) {
            RecentServerEntry existing = it.next();
            if (existing.url().equals(url)) {
                entry = existing.withLastConnected(now);
                it.remove();
            }
        }
        entries.add(0, entry);
        writeRecentServers(entries);
        write(KEY_LAST_SERVER_URL, url);
    }

    public synchronized void removeRecentUrl(String url) {
        List<RecentServerEntry> entries = new ArrayList<>(recentServers());
        if (!entries.removeIf(e -> e.url().equals(url))) {
            return;
        }
        writeRecentServers(entries);
        if (url.equals(lastServerUrl())) {
            if (entries.isEmpty()) {
                remove(KEY_LAST_SERVER_URL);
            }
            else {
                write(KEY_LAST_SERVER_URL, entries.get(0).url());
            }
        }
    }

    /**
     * Sets or clears (null or blank) the user chosen name of a history entry.
     *
     * @return false if there is no entry for the url
     */
    public synchronized boolean renameRecentServer(String url, @Nullable String name) {
        List<RecentServerEntry> entries = new ArrayList<>(recentServers());
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).url().equals(url)) {
                entries.set(i, entries.get(i).withName(name));
                writeRecentServers(entries);
                return true;
            }
        }
        return false;
    }

    @Nullable
    public synchronized String lastServerUrl() {
        return read(KEY_LAST_SERVER_URL);
    }

    /**
     * Forgets the connection history and every persisted session. Sessions that are live in memory
     * are untouched; removing them is the session store's business.
     */
    public synchronized void clearHistory() {
        remove(KEY_RECENT_SERVERS);
        remove(KEY_LAST_SERVER_URL);
        remove(KEY_LEGACY_RECENT_URLS);
        remove(KEY_SESSION_STORE);
        remove(KEY_RENDER_STATES);
        LOGGER.debug("Connection history cleared");
    }

    /**
     * Converts the pipe separated url list of older releases into history entries. Does nothing
     * once the history holds entries.
     *
     * @return the number of entries imported
     */
    public synchronized int migrateLegacyHistory() {
        String legacy = read(KEY_LEGACY_RECENT_URLS);
        if (legacy == null || !recentServers().isEmpty()) {
            return 0;
        }
        long now = clock.millis();
        List<RecentServerEntry> entries = LEGACY_URL_SEPARATOR.splitAsStream(legacy)
                .map(String::trim)
                .filter(url -> !url.isEmpty())
                .distinct()
                .map(url -> new RecentServerEntry(url, null, 0L, now))
                .toList();
        writeRecentServers(entries);
        if (!entries.isEmpty() && read(KEY_LAST_SERVER_URL) == null) {
            write(KEY_LAST_SERVER_URL, entries.get(0).url());
        }
        remove(KEY_LEGACY_RECENT_URLS);
        int imported = Math.min(entries.size(), maxRecentServers);
        LOGGER.info("Migrated {} legacy history entries", imported);
        return imported;
    }

    private void writeRecentServers(List<RecentServerEntry> entries) {
        List<RecentServerEntry> bounded = entries.size() > maxRecentServers ? entries.subList(0, maxRecentServers) : entries;
        writeJson(KEY_RECENT_SERVERS, bounded);
    }

    // ==================== Preferences ====================

    public synchronized boolean autoReconnect() {
        String value = read(KEY_AUTO_RECONNECT);
        return value == null || Boolean.parseBoolean(value);
    }

    public synchronized void setAutoReconnect(boolean autoReconnect) {
        write(KEY_AUTO_RECONNECT, Boolean.toString(autoReconnect));
    }

    // ==================== Render State ====================

    public synchronized void saveRenderState(String sessionId, byte[] state) {
        Map<String, String> states = renderStates();
        states.put(sessionId, Base64.getEncoder().encodeToString(state));
        writeJson(KEY_RENDER_STATES, states);
    }

    @Nullable
    public synchronized byte[] loadRenderState(String sessionId) {
        String encoded = renderStates().get(sessionId);
        if (encoded == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            LOGGER.warn("{}: Discarding undecodable render state", sessionId);
            return null;
        }
    }

    public synchronized void removeRenderState(String sessionId) {
        Map<String, String> states = renderStates();
        if (states.remove(sessionId) != null) {
            if (states.isEmpty()) {
                remove(KEY_RENDER_STATES);
            }
            else {
                writeJson(KEY_RENDER_STATES, states);
            }
        }
    }

    /**
     * Drops the render states of every session not in {@code sessionIds}.
     *
     * @return the number of render states dropped
     */
    public synchronized int retainRenderStates(Collection<String> sessionIds) {
        Map<String, String> states = renderStates();
        int before = states.size();
        states.keySet().retainAll(Set.copyOf(sessionIds));
        int dropped = before - states.size();
        if (dropped == 0) {
            return 0;
        }
        if (states.isEmpty()) {
            remove(KEY_RENDER_STATES);
        }
        else {
            writeJson(KEY_RENDER_STATES, states);
        }
        LOGGER.debug("Dropped {} render states of sessions no longer live", dropped);
        return dropped;
    }

    private Map<String, String> renderStates() {
        Map<String, String> states = new LinkedHashMap<>();
        readJson(KEY_RENDER_STATES, RENDER_STATES_TYPE).ifPresent(states::putAll);
        return states;
    }

    // ==================== Store Access ====================

    private <T> Optional<T> readJson(String key, Class<T> type) {
        String json = read(key);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(json, type));
        }
        catch (IOException e) {
            LOGGER.warn("Discarding unreadable record '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> readJson(String key, TypeReference<T> type) {
        String json = read(key);
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(json, type));
        }
        catch (IOException e) {
            LOGGER.warn("Discarding unreadable record '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeJson(String key, Object value) {
        String json;
        try {
            json = mapper.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record '" + key + "'", e);
        }
        write(key, json);
    }

    @Nullable
    private String read(String key) {
        try {
            return store.get(key);
        }
        catch (PersistenceException e) {
            LOGGER.warn("Failed to read '{}': {}", key, e.getMessage());
            return null;
        }
    }

    private void write(String key, String value) {
        try {
            store.set(key, value);
        }
        catch (PersistenceException e) {
            logWriteFailure(key, e);
        }
    }

    private void remove(String key) {
        try {
            store.remove(key);
        }
        catch (PersistenceException e) {
            logWriteFailure(key, e);
        }
    }

    private static void logWriteFailure(String key, PersistenceException e) {
        LOGGER.warn("Failed to write '{}': {}", key, e.getMessage());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Write failure details for '{}'", key, e);
        }
    }
}
