/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.persistence;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import io.switchboard.client.service.KeyValueStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A {@link KeyValueStore} that lives as long as the process. Used when no store file is configured.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Nullable
    @Override
    public String get(String key) {
        return values.get(key);
    }

    @Override
    public void set(String key, String value) {
        values.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "InMemoryKeyValueStore{keys=" + values.keySet() + '}';
    }
}
