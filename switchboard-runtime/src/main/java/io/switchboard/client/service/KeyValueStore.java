/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.switchboard.client.service;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Durable string storage used to persist session metadata and connection history.
 * <p>
 * Implementations must be crash-consistent: once {@link #set(String, String)} returns, a
 * subsequent {@link #get(String)} from the same process observes the value.
 * </p>
 */
public interface KeyValueStore {

    /**
     * @param key the key
     * @return the stored value, or null if the key is absent
     */
    @Nullable
    String get(String key);

    /**
     * Stores a value, replacing any previous value for the key.
     *
     * @param key the key
     * @param value the value
     */
    void set(String key, String value);

    /**
     * Removes the key. Removing an absent key is not an error.
     *
     * @param key the key
     */
    void remove(String key);
}
