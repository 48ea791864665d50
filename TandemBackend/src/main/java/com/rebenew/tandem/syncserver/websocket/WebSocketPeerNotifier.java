package com.rebenew.tandem.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.tandem.syncserver.core.PeerNotifier;
import com.rebenew.tandem.syncserver.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class WebSocketPeerNotifier implements PeerNotifier {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketPeerNotifier.class);

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebSocketPeerNotifier(ConnectionRegistry registry, ObjectMapper objectMapper, Clock clock) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean sendCommand(String sessionId, PeerRef target, Correction correction) {
        return send(target, SyncMsg.syncCommand(sessionId, correction));
    }

    @Override
    public boolean sendStatus(String sessionId, PeerRef target, DriftReport report, Long lastSyncAtMs) {
        return send(target, SyncMsg.syncStatus(sessionId, report, lastSyncAtMs, clock.millis()));
    }

    @Override
    public boolean sendSessionEnded(String sessionId, PeerRef target, EndReason reason) {
        return send(target, SyncMsg.sessionEnded(sessionId, reason, clock.millis()));
    }

    private boolean send(PeerRef target, SyncMsg msg) {
        if (target == null || !target.isConnected()) {
            logger.debug("Dropping {} for offline peer {}", msg.getType(), target != null ? target.userId() : null);
            return false;
        }
        try {
            boolean sent = registry.send(target.connectionId(), objectMapper.writeValueAsString(msg));
            if (!sent)
                logger.warn("⚠️ {} for {} in session {} was not delivered", msg.getType(), target.userId(),
                        msg.getSessionId());
            return sent;
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializing {}: {}", msg.getType(), e.getMessage(), e);
            return false;
        }
    }
}
