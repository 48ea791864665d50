package com.rebenew.tandem.syncserver.controller;

import com.rebenew.tandem.syncserver.core.SessionManager;
import com.rebenew.tandem.syncserver.exception.SyncException;
import com.rebenew.tandem.syncserver.model.*;
import com.rebenew.tandem.syncserver.websocket.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Control surface for sync sessions.
 *
 * Main flow:
 * 1. Host creates a session → 2. shares the code → 3. client joins here or
 * over the WebSocket → 4. both peers report state over the WebSocket
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final SessionManager sessionManager;
    private final ConnectionRegistry connectionRegistry;

    public SessionController(SessionManager sessionManager, ConnectionRegistry connectionRegistry) {
        this.sessionManager = sessionManager;
        this.connectionRegistry = connectionRegistry;
    }

    /**
     * @param request {"userId": "host1"}
     * @return {"sessionId": "K3Q9ZD", "role": "host", "expiresAt": ...}
     */
    @PostMapping
    public ResponseEntity<CreateSessionResponse> create(@RequestBody SessionRequest request) {
        String userId = requireUserId(request);
        logger.info("📝 Create session requested by {}", userId);
        SyncSession session = sessionManager.createSession(userId);
        return ResponseEntity.ok(CreateSessionResponse.of(session));
    }

    @PostMapping("/{sessionId}/join")
    public ResponseEntity<JoinSessionResponse> join(@PathVariable String sessionId, @RequestBody SessionRequest request) {
        String userId = requireUserId(request);
        logger.info("🚪 Join requested for session {} by {}", sessionId, userId);
        return ResponseEntity.ok(JoinSessionResponse.of(sessionManager.joinSession(sessionId, userId)));
    }

    /**
     * @param request {"userId": "client1", "offsetMs": -250}
     * @return the offset actually stored, clamped to the allowed range
     */
    @PatchMapping("/{sessionId}/offset")
    public ResponseEntity<Map<String, Object>> updateOffset(@PathVariable String sessionId,
            @RequestBody OffsetRequest request) {
        if (request == null || request.getUserId() == null || request.getUserId().isBlank()) {
            throw SyncException.invalid("userId is required");
        }
        if (request.getOffsetMs() == null) {
            throw SyncException.invalid("offsetMs is required");
        }
        long stored = sessionManager.updateOffset(sessionId, request.getUserId(), request.getOffsetMs());

        Map<String, Object> body = new HashMap<>();
        body.put("sessionId", sessionId);
        body.put("offsetMs", stored);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{sessionId}/sync")
    public ResponseEntity<Map<String, String>> requestSync(@PathVariable String sessionId,
            @RequestBody SessionRequest request) {
        String userId = requireUserId(request);
        sessionManager.requestImmediateSync(sessionId, userId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "status", "sync_requested"));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> getState(@PathVariable String sessionId) {
        logger.debug("🔍 State requested for session {}", sessionId);
        return ResponseEntity.ok(sessionManager.getSessionView(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, String>> end(@PathVariable String sessionId,
            @RequestBody(required = false) SessionRequest request) {
        String userId = requireUserId(request);
        sessionManager.endSession(sessionId, userId);
        logger.info("✅ Session {} ended by {}", sessionId, userId);
        return ResponseEntity.ok(Map.of("status", "ended"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>(sessionManager.getServiceStats());
        healthInfo.put("openConnections", connectionRegistry.getConnectionCount());
        healthInfo.put("service", "tandem-sync");
        healthInfo.put("health", "healthy");
        return ResponseEntity.ok(healthInfo);
    }

    private static String requireUserId(SessionRequest request) {
        if (request == null || request.getUserId() == null || request.getUserId().trim().isEmpty()) {
            throw SyncException.invalid("userId is required");
        }
        return request.getUserId();
    }
}
