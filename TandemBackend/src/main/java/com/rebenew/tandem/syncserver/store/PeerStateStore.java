package com.rebenew.tandem.syncserver.store;

import java.util.function.UnaryOperator;

/**
 * Read/write contract for per-session peer state. Implementations must apply
 * {@link #update} atomically per session; no policy lives here.
 */
public interface PeerStateStore {

    /**
     * @return the current state, or {@link PeerState#EMPTY} if nothing was reported yet
     */
    PeerState get(String sessionId);

    /**
     * Atomically replaces the session's state with the result of the mutation.
     *
     * @return the state after the mutation
     */
    PeerState update(String sessionId, UnaryOperator<PeerState> mutation);

    void remove(String sessionId);

    int size();
}
