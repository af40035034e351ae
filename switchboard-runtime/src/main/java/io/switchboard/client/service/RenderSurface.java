/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.switchboard.client.service;

/**
 * The embeddable browser surface that displays the content of the active session.
 * <p>
 * The session manager never inspects what is displayed. It only tells the surface which
 * endpoint to load and exchanges an opaque state blob with it when sessions are switched.
 * </p>
 */
public interface RenderSurface {

    /**
     * Begins fetching and displaying the given url.
     *
     * @param url absolute http(s) url
     */
    void load(String url);

    /**
     * Captures the surface's navigation, scroll and form state.
     *
     * @return opaque state, owned by the caller
     */
    byte[] captureState();

    /**
     * Restores a blob previously produced by {@link #captureState()}.
     *
     * @param state opaque state
     */
    void restoreState(byte[] state);
}
