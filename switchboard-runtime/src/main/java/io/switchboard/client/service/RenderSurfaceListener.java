/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.switchboard.client.service;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Page lifecycle callbacks reported by a {@link RenderSurface}.
 */
public interface RenderSurfaceListener {

    void onPageStarted(@Nullable String url);

    void onPageFinished(@Nullable String url);

    /**
     * A main-frame load failed.
     *
     * @param message user-facing description, never parsed
     */
    void onError(String message);

    /**
     * The TLS handshake was rejected. The surface has already cancelled the load.
     *
     * @param message user-facing description, never parsed
     */
    void onSslError(String message);
}
