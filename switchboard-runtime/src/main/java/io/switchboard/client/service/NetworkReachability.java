/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.switchboard.client.service;

/**
 * Source of the device's network availability.
 * <p>
 * The session manager only polls this when the caller asks for a reconnect. Changes are pushed
 * in by the caller through {@code Switchboard#onNetworkAvailabilityChanged(boolean)}.
 * </p>
 */
@FunctionalInterface
public interface NetworkReachability {

    /**
     * A reachability source that always reports the network as available.
     */
    NetworkReachability ALWAYS_ONLINE = () -> true;

    boolean isOnline();
}
