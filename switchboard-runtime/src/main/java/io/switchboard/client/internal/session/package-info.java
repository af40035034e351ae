/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Live server sessions and the active session pointer.
 *
 * <ul>
 *   <li>{@link io.switchboard.client.internal.session.Session} -
 *       one logical connection to a server, identified by its canonical url</li>
 *
 *   <li>{@link io.switchboard.client.internal.session.SessionStore} -
 *       owns the live sessions, enforces capacity by eviction and mirrors every change
 *       to the {@link io.switchboard.client.internal.persistence.PersistenceAdapter}</li>
 *
 *   <li>{@link io.switchboard.client.internal.session.RenderStateBridge} -
 *       keeps the opaque render state captured for each session</li>
 * </ul>
 *
 * <h2>Event Ordering</h2>
 *
 * <pre>
 *   createSession(url)     ──► SessionCreated, ActiveSessionChanged
 *   setActiveSession(id)   ──► ActiveSessionChanged
 *   updateSessionState(..) ──► SessionStateChanged
 *   removeSession(id)      ──► SessionRemoved [, ActiveSessionChanged]
 * </pre>
 *
 * <p>Eviction at capacity is reported only as {@code SessionRemoved}, delivered before the
 * {@code SessionCreated} of the session that caused it.</p>
 *
 * @see io.switchboard.client.internal.session.SessionListener
 */

@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.switchboard.client.internal.session;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
