/*
 * Copyright Switchboard Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.switchboard.client.internal.session;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.switchboard.client.internal.persistence.PersistenceAdapter;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Holds the opaque render state captured from the rendering surface for each session, so a
 * session can be shown again without reloading it.
 *
 * <p>Blobs are copied on the way in and on the way out. When constructed with a
 * {@link PersistenceAdapter}, every save is also written through to the store so render state
 * survives a restart.</p>
 *
 * <p>The bridge must be registered as a listener on the {@link SessionStore} so that state of a
 * removed or evicted session is discarded.</p>
 */
public class RenderStateBridge implements SessionListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(RenderStateBridge.class);

    private final SessionStore sessionStore;
    private final @Nullable PersistenceAdapter writeThrough;
    private final Map<String, byte[]> states = new ConcurrentHashMap<>();

    public RenderStateBridge(SessionStore sessionStore) {
        this(sessionStore, null);
    }

    public RenderStateBridge(SessionStore sessionStore, @Nullable PersistenceAdapter writeThrough) {
        this.sessionStore = Objects.requireNonNull(sessionStore);
        this.writeThrough = writeThrough;
    }

    /**
     * Replaces the saved state of a live session.
     *
     * @return false if the session is not live, in which case nothing is saved
     */
    public boolean saveState(String sessionId, byte[] renderState) {
        Objects.requireNonNull(renderState, "renderState");
        byte[] copy = renderState.clone();
        if (!sessionStore.attachRenderState(sessionId, copy)) {
            LOGGER.debug("{}: Ignoring render state for unknown session", sessionId);
            return false;
        }
        states.put(sessionId, copy);
        if (writeThrough != null) {
            writeThrough.saveRenderState(sessionId, copy);
        }
        LOGGER.trace("{}: Saved {} bytes of render state", sessionId, copy.length);
        return true;
    }

    /**
     * Looks up the in-memory state first, then the state attached to the session, then the
     * persisted state.
     *
     * @return a copy of the saved state, or null if there is none
     */
    @Nullable
    public byte[] loadState(String sessionId) {
        byte[] state = states.get(sessionId);
        if (state != null) {
            return state.clone();
        }

        Session session = sessionStore.getSession(sessionId);
        if (session != null) {
            // Session.renderState() already returns a copy
            state = session.renderState();
            if (state != null) {
                return state;
            }
        }

        if (writeThrough != null) {
            state = writeThrough.loadRenderState(sessionId);
            if (state != null) {
                LOGGER.debug("{}: Loaded persisted render state", sessionId);
                states.put(sessionId, state);
                return state.clone();
            }
        }
        return null;
    }

    public boolean hasState(String sessionId) {
        return states.containsKey(sessionId);
    }

    public void discard(String sessionId) {
        if (states.remove(sessionId) != null) {
            LOGGER.trace("{}: Discarded render state", sessionId);
        }
        if (writeThrough != null) {
            writeThrough.removeRenderState(sessionId);
        }
    }

    @Override
    public void onSessionRemoved(Session session) {
        discard(session.id());
    }

    @Override
    public String toString() {
        return "RenderStateBridge{" +
                "states=" + states.size() +
                ", writeThrough=" + (writeThrough != null) +
                '}';
    }
}
