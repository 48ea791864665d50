package com.rebenew.tandem.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.tandem.syncserver.core.SessionCodeGenerator;
import com.rebenew.tandem.syncserver.core.SessionManager;
import com.rebenew.tandem.syncserver.exception.SyncException;
import com.rebenew.tandem.syncserver.model.PeerRole;
import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;
import com.rebenew.tandem.syncserver.model.SyncMsg;
import com.rebenew.tandem.syncserver.model.SyncSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;

/**
 * Event surface of the coordinator. Decodes peer envelopes into SessionManager
 * calls and answers each one with an ack or an error; a bad message never
 * closes the connection.
 */
@Component
public class SyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final SessionManager sessionManager;
    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SyncWebSocketHandler(SessionManager sessionManager, ConnectionRegistry registry,
            ObjectMapper objectMapper, Clock clock) {
        this.sessionManager = sessionManager;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== WEBSOCKET LIFECYCLE ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        logger.info("🔄 New WebSocket connection: {}", session.getId());
        registry.register(session);
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        SyncMsg msg;
        try {
            msg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
        } catch (JsonProcessingException e) {
            logger.warn("❌ Malformed message on {}: {}", session.getId(), e.getOriginalMessage());
            sendError(session, "invalid_message", "Message is not a valid envelope", null);
            return;
        }
        if (msg == null) {
            logger.warn("❌ Empty envelope on {}", session.getId());
            sendError(session, "invalid_message", "Message is not a valid envelope", null);
            return;
        }
        processMessage(session, msg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        PeerBinding binding = registry.unregister(session.getId());
        if (binding != null) {
            sessionManager.peerDisconnected(binding.sessionId(), session.getId());
            logger.info("🔌 Connection closed: {} - session {} ({})", session.getId(), binding.sessionId(),
                    binding.role().wire());
        } else {
            logger.info("🔌 Connection closed: {}", session.getId());
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 WebSocket transport error: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== DISPATCH ====================

    void processMessage(WebSocketSession session, SyncMsg msg) {
        String correlationId = msg.getCorrelationId();
        InboundType type = InboundType.fromWire(msg.getType());
        if (type == null) {
            logger.warn("Unknown message type '{}' on {}", msg.getType(), session.getId());
            sendError(session, "invalid_message", "Unknown message type: " + msg.getType(), correlationId);
            return;
        }

        try {
            switch (type) {
                case JOIN_SESSION:
                    handleJoin(session, msg);
                    break;
                case PLAYBACK_STATE:
                    handleHostState(session, msg);
                    break;
                case CLIENT_STATE:
                    handleClientState(session, msg);
                    break;
                case REQUEST_SYNC:
                    handleSyncRequest(session, msg);
                    break;
                case UPDATE_OFFSET:
                    handleOffset(session, msg);
                    break;
                case END_SESSION:
                    handleEnd(session, msg);
                    break;
                case HEARTBEAT:
                    sendAck(session, "heartbeat_received", correlationId);
                    break;
            }
        } catch (SyncException e) {
            logger.warn("Rejected {} on {}: {}", msg.getType(), session.getId(), e.getMessage());
            sendError(session, e.getCode(), e.getMessage(), correlationId);
        } catch (Exception e) {
            logger.error("❌ Error processing message {}: {}", msg.getType(), e.getMessage(), e);
            sendError(session, "processing_error", "Message could not be processed", correlationId);
        }
    }

    // ==================== HANDLERS ====================

    private void handleJoin(WebSocketSession session, SyncMsg msg) {
        String sessionId = msg.getSessionId();
        String userId = msg.getUserId();
        PeerRole role = PeerRole.fromWire(msg.getStringData("role"));
        if (sessionId == null || userId == null || role == null) {
            throw SyncException.invalid("join_session requires sessionId, userId and data.role");
        }

        // One connection, one peer: re-joining is allowed only with the same identity.
        PeerBinding existing = registry.getBinding(session.getId());
        if (existing != null && (!existing.sessionId().equals(SessionCodeGenerator.normalize(sessionId))
                || existing.role() != role || !existing.userId().equals(userId))) {
            logger.warn("Connection {} already bound to session {} as {}, rejecting join of {}", session.getId(),
                    existing.sessionId(), existing.role().wire(), sessionId);
            throw SyncException.forbidden("Connection is already bound to session " + existing.sessionId());
        }

        SyncSession syncSession = sessionManager.attachPeer(sessionId, role, userId, session.getId());
        registry.bind(session.getId(), new PeerBinding(syncSession.getSessionId(), role, userId));

        logger.info("🔐 Connection {} bound to session {} as {} ({})", session.getId(),
                syncSession.getSessionId(), role.wire(), userId);
        sendAck(session, "joined", msg.getCorrelationId());
    }

    private void handleHostState(WebSocketSession session, SyncMsg msg) {
        PeerBinding binding = requireBinding(session, msg, PeerRole.HOST);
        sessionManager.reportHostState(binding.sessionId(), session.getId(), readSnapshot(msg));
        sendAck(session, "state_received", msg.getCorrelationId());
    }

    private void handleClientState(WebSocketSession session, SyncMsg msg) {
        PeerBinding binding = requireBinding(session, msg, PeerRole.CLIENT);
        sessionManager.reportClientState(binding.sessionId(), session.getId(), readSnapshot(msg));
        sendAck(session, "state_received", msg.getCorrelationId());
    }

    private void handleSyncRequest(WebSocketSession session, SyncMsg msg) {
        PeerBinding binding = requireBinding(session, msg, PeerRole.CLIENT);
        sessionManager.requestImmediateSync(binding.sessionId(), binding.userId());
        sendAck(session, "sync_requested", msg.getCorrelationId());
    }

    private void handleOffset(WebSocketSession session, SyncMsg msg) {
        PeerBinding binding = requireBinding(session, msg, PeerRole.CLIENT);
        Long offsetMs = msg.getLongData("offsetMs");
        if (offsetMs == null)
            throw SyncException.invalid("update_offset requires data.offsetMs");
        sessionManager.updateOffset(binding.sessionId(), binding.userId(), offsetMs);
        sendAck(session, "offset_updated", msg.getCorrelationId());
    }

    private void handleEnd(WebSocketSession session, SyncMsg msg) {
        PeerBinding binding = requireBinding(session, msg, PeerRole.HOST);
        sessionManager.endSession(binding.sessionId(), binding.userId());
        sendAck(session, "session_ended", msg.getCorrelationId());
    }

    // ==================== VALIDATION ====================

    private PeerBinding requireBinding(WebSocketSession session, SyncMsg msg, PeerRole expected) {
        PeerBinding binding = registry.getBinding(session.getId());
        if (binding == null)
            throw SyncException.forbidden("Connection has not joined a session");
        if (binding.role() != expected)
            throw SyncException.forbidden(msg.getType() + " is only accepted from the " + expected.wire());
        String claimed = SessionCodeGenerator.normalize(msg.getSessionId());
        if (claimed != null && !claimed.equals(binding.sessionId()))
            throw SyncException.forbidden("Connection is bound to a different session");
        return binding;
    }

    // Stamped with the coordinator clock; the peer's own timestamp is informational only.
    private PlaybackSnapshot readSnapshot(SyncMsg msg) {
        String trackId = msg.getStringData("trackId");
        Long positionMs = msg.getLongData("positionMs");
        Boolean isPlaying = msg.getBoolData("isPlaying");
        if (trackId == null || trackId.isBlank() || positionMs == null || isPlaying == null) {
            throw SyncException.invalid(msg.getType() + " requires data.trackId, data.positionMs and data.isPlaying");
        }
        if (positionMs < 0)
            throw SyncException.invalid("positionMs cannot be negative");
        logger.debug("{} from {}: {} @ {}ms playing={} (peer ts {})", msg.getType(), msg.getUserId(), trackId,
                positionMs, isPlaying, msg.getLongData("timestampMs"));
        return new PlaybackSnapshot(trackId, positionMs, isPlaying, clock.millis());
    }

    // ==================== REPLIES ====================

    private void sendAck(WebSocketSession session, String reason, String correlationId) {
        reply(session, SyncMsg.ack(true, reason, correlationId, clock.millis()));
    }

    private void sendError(WebSocketSession session, String code, String message, String correlationId) {
        reply(session, SyncMsg.error(code, message, correlationId, clock.millis()));
    }

    private void reply(WebSocketSession session, SyncMsg msg) {
        try {
            registry.safeSend(session, objectMapper.writeValueAsString(msg));
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializing reply {}: {}", msg.getType(), e.getMessage(), e);
        }
    }
}
