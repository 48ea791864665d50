package com.rebenew.tandem.syncserver.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

// Connection id -> socket, and connection id -> (session, role, user).
@Component
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentMap<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PeerBinding> bindings = new ConcurrentHashMap<>();

    public void register(WebSocketSession session) {
        connections.put(session.getId(), session);
    }

    /**
     * Forgets the connection.
     *
     * @return the binding it had, or null if it never joined a session
     */
    public PeerBinding unregister(String connectionId) {
        connections.remove(connectionId);
        return bindings.remove(connectionId);
    }

    public void bind(String connectionId, PeerBinding binding) {
        bindings.put(connectionId, binding);
    }

    public PeerBinding getBinding(String connectionId) {
        return bindings.get(connectionId);
    }

    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Sends to a live connection. Unknown or closed connections are dropped.
     *
     * @return true if the frame was written
     */
    public boolean send(String connectionId, String json) {
        if (connectionId == null)
            return false;
        WebSocketSession session = connections.get(connectionId);
        if (session == null || !session.isOpen()) {
            logger.debug("Dropping message for unavailable connection {}", connectionId);
            return false;
        }
        return safeSend(session, json);
    }

    public boolean safeSend(WebSocketSession session, String json) {
        try {
            if (!session.isOpen())
                return false;
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (IOException | IllegalStateException e) {
            logger.warn("⚠️ Error sending WebSocket message to {}: {}", session.getId(), e.getMessage());
            return false;
        }
    }
}
