package com.rebenew.tandem.syncserver.store;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryPeerStateStore implements PeerStateStore {
    private final ConcurrentMap<String, PeerState> states = new ConcurrentHashMap<>();

    @Override
    public PeerState get(String sessionId) {
        return states.getOrDefault(sessionId, PeerState.EMPTY);
    }

    @Override
    public PeerState update(String sessionId, UnaryOperator<PeerState> mutation) {
        return states.compute(sessionId, (id, current) -> {
            PeerState next = mutation.apply(current != null ? current : PeerState.EMPTY);
            if (next == null)
                throw new IllegalStateException("Mutation returned null state for session " + id);
            return next;
        });
    }

    @Override
    public void remove(String sessionId) {
        states.remove(sessionId);
    }

    @Override
    public int size() {
        return states.size();
    }
}
