/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Client-side manager for several concurrent connections to remote HTTP(S) servers.
 *
 * <p>{@link io.switchboard.client.Switchboard} is the entry point. It is created once from a
 * {@link io.switchboard.client.config.SwitchboardConfig} and the host's
 * {@link io.switchboard.client.service.RenderSurface}, and coordinates:</p>
 *
 * <pre>
 *   user input ──► UrlNormalizer ──► SessionStore.createSession
 *                                          │
 *   RenderSurface callbacks ──► ConnectionStateMachine ──► SessionStore.updateSessionState
 *                                          │
 *                                          ▼
 *                                 PersistenceAdapter ──► KeyValueStore
 * </pre>
 */

@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.switchboard.client;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
