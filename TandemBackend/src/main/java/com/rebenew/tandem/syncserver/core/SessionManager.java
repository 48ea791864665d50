package com.rebenew.tandem.syncserver.core;

import com.rebenew.tandem.syncserver.config.SyncProperties;
import com.rebenew.tandem.syncserver.exception.SyncException;
import com.rebenew.tandem.syncserver.model.*;
import com.rebenew.tandem.syncserver.store.PeerState;
import com.rebenew.tandem.syncserver.store.PeerStateStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

// Owns the session table, membership rules and every trigger of the SyncEngine.
// Each mutation and the evaluation after it run under the session monitor;
// messages are sent only after the monitor is released.

@Service
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);
    private static final int MAX_CODE_ATTEMPTS = 32;

    // ============================
    // MAIN STATE
    // ============================
    private final ConcurrentHashMap<String, SyncSession> sessions = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final SyncEngine syncEngine;
    private final PeerStateStore stateStore;
    private final PeerNotifier notifier;
    private final SessionCodeGenerator codeGenerator;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final SyncProperties properties;

    public SessionManager(SyncEngine syncEngine, PeerStateStore stateStore, PeerNotifier notifier,
            SessionCodeGenerator codeGenerator, ScheduledExecutorService syncScheduler, Clock clock,
            SyncProperties properties) {
        this.syncEngine = syncEngine;
        this.stateStore = stateStore;
        this.notifier = notifier;
        this.codeGenerator = codeGenerator;
        this.scheduler = syncScheduler;
        this.clock = clock;
        this.properties = properties;
        logger.info("SessionManager initialized (timeout={}ms, periodic={}ms, grace={}ms, maxSessions={})",
                properties.getSessionTimeoutMs(), properties.getPeriodicSyncIntervalMs(),
                properties.getHostGraceMs(), properties.getMaxSessions());
    }

    // ====================
    // CREATION / JOIN
    // ====================

    public SyncSession createSession(String hostUserId) {
        validateUserId(hostUserId);
        long now = clock.millis();
        SyncSession session;

        synchronized (creationLock) {
            int max = properties.getMaxSessions();
            if (max > 0 && sessions.size() >= max) {
                logger.warn("Session limit reached ({}), rejecting host {}", max, hostUserId);
                throw SyncException.capacityExceeded(max);
            }
            session = null;
            for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS && session == null; attempt++) {
                SyncSession candidate = new SyncSession(codeGenerator.next(), hostUserId, now,
                        properties.getSessionTimeoutMs());
                if (sessions.putIfAbsent(candidate.getSessionId(), candidate) == null)
                    session = candidate;
            }
            if (session == null)
                throw new IllegalStateException("Could not generate a free session code");
        }

        String sessionId = session.getSessionId();
        session.setExpiryTask(scheduler.schedule(() -> safeRun("expiry", sessionId, () -> expireSession(sessionId)),
                properties.getSessionTimeoutMs(), TimeUnit.MILLISECONDS));

        logger.info("🎵 Session created: {} by host: {} (expiresAt={})", sessionId, hostUserId, session.getExpiresAt());
        return session;
    }

    /**
     * Registers the client and forces an immediate full sync against the
     * host's current state, without waiting for the periodic cycle.
     */
    public JoinResult joinSession(String sessionId, String clientUserId) {
        validateUserId(clientUserId);
        SyncSession session = requireLive(sessionId);
        long now = clock.millis();
        SyncOutcome outcome;

        synchronized (session) {
            ensureNotEnded(session);
            registerClientLocked(session, clientUserId);
            outcome = forceSyncLocked(session, now);
        }

        deliver(session, outcome);
        return new JoinResult(session.getSessionId(), session.getHost().userId(), session.getExpiresAt(),
                outcome.correction());
    }

    /**
     * Binds a live connection to a peer. A host binding resumes the session
     * after a disconnect; a client binding joins (slot free) or reconnects
     * (slot owned) and in both cases gets a forced sync.
     */
    public SyncSession attachPeer(String sessionId, PeerRole role, String userId, String connectionId) {
        validateUserId(userId);
        if (role == null)
            throw SyncException.invalid("role is required");
        SyncSession session = requireLive(sessionId);
        long now = clock.millis();
        SyncOutcome outcome = SyncOutcome.NONE;

        synchronized (session) {
            ensureNotEnded(session);
            if (role == PeerRole.HOST) {
                if (!session.isHost(userId)) {
                    logger.warn("User {} tried to bind as host of session {}", userId, session.getSessionId());
                    throw SyncException.forbidden("Only the session host can connect as host");
                }
                boolean resumed = session.hasHostGrace();
                session.cancelHostGrace();
                session.attachHost(connectionId, now);
                logger.info("👑 Host {} {} session {} [{}]", userId, resumed ? "resumed" : "connected to",
                        session.getSessionId(), connectionId);
            } else {
                registerClientLocked(session, userId);
                session.attachClient(connectionId);
                outcome = forceSyncLocked(session, now);
                logger.info("👤 Client {} connected to session {} [{}]", userId, session.getSessionId(), connectionId);
            }
        }

        deliver(session, outcome);
        return session;
    }

    private void registerClientLocked(SyncSession session, String clientUserId) {
        if (session.isHost(clientUserId)) {
            logger.warn("Host {} tried to join own session {} as client", clientUserId, session.getSessionId());
            throw SyncException.forbidden("The host cannot join its own session as client");
        }
        boolean rejoin = session.isClient(clientUserId);
        if (!session.registerClient(clientUserId)) {
            logger.warn("Session {} is full, rejecting client {}", session.getSessionId(), clientUserId);
            throw SyncException.sessionFull(session.getSessionId());
        }
        ensurePeriodicSync(session);
        if (!rejoin)
            logger.info("👤 Client {} joined session {}", clientUserId, session.getSessionId());
    }

    // ====================
    // STATE REPORTS
    // ====================

    /**
     * Stores the host's snapshot. The first report and every track change
     * trigger an evaluation right away (song-transition sync).
     */
    public void reportHostState(String sessionId, String connectionId, PlaybackSnapshot snapshot) {
        SyncSession session = requireLive(sessionId);
        long now = clock.millis();
        SyncOutcome outcome = SyncOutcome.NONE;

        synchronized (session) {
            ensureNotEnded(session);
            if (!session.isHostConnection(connectionId)) {
                logger.warn("Rejected host report for session {} from connection {}", sessionId, connectionId);
                throw SyncException.forbidden("Only the host connection can report host state");
            }
            session.touchHost(now);
            PlaybackSnapshot previous = stateStore.get(session.getSessionId()).hostSnapshot();
            stateStore.update(session.getSessionId(), s -> s.withHostSnapshot(snapshot));

            boolean trackChanged = previous == null || !previous.trackId().equals(snapshot.trackId());
            if (trackChanged && session.hasClient()) {
                logger.debug("Track change in session {}: {} -> {}", sessionId,
                        previous != null ? previous.trackId() : "none", snapshot.trackId());
                outcome = evaluateLocked(session, now, true);
            }
        }

        deliver(session, outcome);
    }

    // Client reports only feed the store; the client is the target of corrections, not the driver.
    public void reportClientState(String sessionId, String connectionId, PlaybackSnapshot snapshot) {
        SyncSession session = requireLive(sessionId);
        synchronized (session) {
            ensureNotEnded(session);
            if (!session.isClientConnection(connectionId)) {
                logger.warn("Rejected client report for session {} from connection {}", sessionId, connectionId);
                throw SyncException.forbidden("Only the client connection can report client state");
            }
            stateStore.update(session.getSessionId(), s -> s.withClientSnapshot(snapshot));
        }
    }

    // ====================
    // CLIENT CONTROLS
    // ====================

    /**
     * Clamps and stores the client offset, then re-evaluates immediately.
     *
     * @return the offset actually stored
     */
    public long updateOffset(String sessionId, String clientUserId, long offsetMs) {
        SyncSession session = requireLive(sessionId);
        long clamped = clampOffset(offsetMs);
        long now = clock.millis();
        SyncOutcome outcome;

        synchronized (session) {
            ensureNotEnded(session);
            requireClient(session, clientUserId);
            stateStore.update(session.getSessionId(), s -> s.withClientOffset(clamped));
            outcome = evaluateLocked(session, now, false);
        }

        if (clamped != offsetMs)
            logger.debug("Offset {}ms clamped to {}ms in session {}", offsetMs, clamped, sessionId);
        deliver(session, outcome);
        return clamped;
    }

    /**
     * One evaluation cycle regardless of the periodic timer. A client that has
     * not reported yet gets a full resync.
     *
     * @return the correction sent, or null if none was needed
     */
    public Correction requestImmediateSync(String sessionId, String clientUserId) {
        SyncSession session = requireLive(sessionId);
        long now = clock.millis();
        SyncOutcome outcome;

        synchronized (session) {
            ensureNotEnded(session);
            requireClient(session, clientUserId);
            outcome = evaluateLocked(session, now, true);
        }

        deliver(session, outcome);
        logger.debug("Immediate sync in session {} -> {}", sessionId, outcome.correction());
        return outcome.correction();
    }

    // ====================
    // SCHEDULED CYCLES
    // ====================

    /**
     * Periodic evaluation. A missing session or a session without client is
     * a no-op.
     */
    public Correction runPeriodicSync(String sessionId) {
        SyncSession session = sessions.get(sessionId);
        if (session == null)
            return null;
        long now = clock.millis();
        if (session.isExpired(now)) {
            terminate(session, EndReason.SESSION_EXPIRED);
            return null;
        }
        SyncOutcome outcome;
        synchronized (session) {
            if (session.isEnded() || !session.hasClient())
                return null;
            outcome = evaluateLocked(session, now, false);
        }
        deliver(session, outcome);
        return outcome.correction();
    }

    public void expireSession(String sessionId) {
        SyncSession session = sessions.get(sessionId);
        if (session != null)
            terminate(session, EndReason.SESSION_EXPIRED);
    }

    // Grace window elapsed: end unless the host came back in the meantime.
    public void hostGraceExpired(String sessionId) {
        SyncSession session = sessions.get(sessionId);
        if (session == null)
            return;
        synchronized (session) {
            if (session.isEnded() || session.getHost().isConnected())
                return;
        }
        logger.warn("💀 Host of session {} did not reconnect in time", sessionId);
        terminate(session, EndReason.HOST_DISCONNECTED);
    }

    // ====================
    // END / DISCONNECT
    // ====================

    public void endSession(String sessionId, String byUserId) {
        SyncSession session = requireLive(sessionId);
        if (!session.isHost(byUserId)) {
            logger.warn("Unauthorized attempt to end session {} by {}", sessionId, byUserId);
            throw SyncException.forbidden("Only the host can end the session");
        }
        terminate(session, EndReason.HOST_ENDED);
    }

    /**
     * Connection loss. A host disconnect starts the grace timer; a client
     * disconnect leaves the session active for the client to resume.
     */
    public void peerDisconnected(String sessionId, String connectionId) {
        SyncSession session = sessions.get(sessionId);
        if (session == null)
            return;
        long now = clock.millis();

        synchronized (session) {
            if (session.isEnded())
                return;
            PeerRole role = session.detach(connectionId, now);
            if (role == PeerRole.HOST) {
                long grace = Math.min(properties.getHostGraceMs(), session.remainingMs(now));
                session.setHostGraceTask(scheduler.schedule(
                        () -> safeRun("host-grace", sessionId, () -> hostGraceExpired(sessionId)),
                        grace, TimeUnit.MILLISECONDS));
                logger.warn("👑 Host of session {} disconnected, waiting {}ms", sessionId, grace);
            } else if (role == PeerRole.CLIENT) {
                stateStore.update(session.getSessionId(), s -> s.withClientSnapshot(null));
                logger.info("👤 Client of session {} disconnected, session stays active", sessionId);
            } else {
                logger.debug("Ignoring stale connection {} for session {}", connectionId, sessionId);
            }
        }
    }

    private void terminate(SyncSession session, EndReason reason) {
        synchronized (session) {
            if (!session.end(reason))
                return;
        }
        String sessionId = session.getSessionId();
        sessions.remove(sessionId, session);
        stateStore.remove(sessionId);

        PeerRef client = session.getClient();
        if (client != null)
            notifier.sendSessionEnded(sessionId, client, reason);
        if (reason == EndReason.SESSION_EXPIRED)
            notifier.sendSessionEnded(sessionId, session.getHost(), reason);

        logger.info("🗑️ Session {} ended: {}", sessionId, reason.wire());
    }

    // ====================
    // QUERIES
    // ====================

    public SyncSession getSession(String sessionId) {
        return requireLive(sessionId);
    }

    public SessionView getSessionView(String sessionId) {
        SyncSession session = requireLive(sessionId);
        long now = clock.millis();
        synchronized (session) {
            PeerState state = stateStore.get(session.getSessionId());
            PeerRef client = session.getClient();
            return SessionView.builder()
                    .sessionId(session.getSessionId())
                    .state(session.getState())
                    .hostUserId(session.getHost().userId())
                    .hostConnected(session.getHost().isConnected())
                    .clientUserId(client != null ? client.userId() : null)
                    .clientConnected(client != null && client.isConnected())
                    .hostSnapshot(state.hostSnapshot())
                    .clientSnapshot(state.clientSnapshot())
                    .clientOffsetMs(state.clientOffsetMs())
                    .createdAt(session.getCreatedAt())
                    .expiresAt(session.getExpiresAt())
                    .hostLastSeenAt(session.getLastHostActivity())
                    .lastSyncAt(session.getLastSyncAt())
                    .drift(syncEngine.measure(state.hostSnapshot(), state.clientSnapshot(),
                            state.clientOffsetMs(), now))
                    .build();
        }
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public Map<String, Object> getServiceStats() {
        Map<SessionState, Integer> byState = new EnumMap<>(SessionState.class);
        sessions.values().forEach(s -> byState.merge(s.getState(), 1, Integer::sum));

        Map<String, Object> stats = new HashMap<>();
        stats.put("totalSessions", sessions.size());
        stats.put("idleSessions", byState.getOrDefault(SessionState.IDLE, 0));
        stats.put("activeSessions", byState.getOrDefault(SessionState.ACTIVE, 0));
        stats.put("connectedHosts", sessions.values().stream().filter(s -> s.getHost().isConnected()).count());
        stats.put("maxSessions", properties.getMaxSessions());
        stats.put("periodicSyncIntervalMs", properties.getPeriodicSyncIntervalMs());
        stats.put("status", shuttingDown.get() ? "SHUTTING_DOWN" : "ACTIVE");
        stats.put("timestamp", clock.millis());
        return stats;
    }

    public long clampOffset(long offsetMs) {
        long max = properties.getMaxOffsetMs();
        return Math.max(-max, Math.min(max, offsetMs));
    }

    // ==================== EVALUATION & DELIVERY ====================

    /**
     * Must be called holding the session monitor.
     *
     * @param force resync from the host snapshot alone when the client has not reported yet
     */
    private SyncOutcome evaluateLocked(SyncSession session, long now, boolean force) {
        PeerRef client = session.getClient();
        if (client == null)
            return SyncOutcome.NONE;

        PeerState state = stateStore.get(session.getSessionId());
        PlaybackSnapshot host = state.hostSnapshot();
        PlaybackSnapshot clientSnapshot = state.clientSnapshot();
        long offset = state.clientOffsetMs();

        Correction correction = (clientSnapshot == null && force)
                ? syncEngine.forcedSync(host, offset, now)
                : syncEngine.evaluate(host, clientSnapshot, offset, now);
        DriftReport drift = syncEngine.measure(host, clientSnapshot, offset, now);

        if (correction != null)
            session.setLastSyncAt(now);
        return new SyncOutcome(session.getHost(), client, correction, drift, session.getLastSyncAt());
    }

    /**
     * Full resync from the host snapshot alone, whatever the client last
     * reported. Used when a client (re)joins: its player may have stopped
     * since its last report. Must be called holding the session monitor.
     */
    private SyncOutcome forceSyncLocked(SyncSession session, long now) {
        PeerRef client = session.getClient();
        if (client == null)
            return SyncOutcome.NONE;

        PeerState state = stateStore.get(session.getSessionId());
        Correction correction = syncEngine.forcedSync(state.hostSnapshot(), state.clientOffsetMs(), now);
        if (correction != null)
            session.setLastSyncAt(now);
        return new SyncOutcome(session.getHost(), client, correction, null, session.getLastSyncAt());
    }

    // Runs outside the session monitor. A session ended meanwhile gets nothing.
    private void deliver(SyncSession session, SyncOutcome outcome) {
        if (outcome.isEmpty())
            return;
        if (session.isEnded()) {
            logger.debug("Suppressing delivery for ended session {} ({})", session.getSessionId(),
                    session.getEndReason());
            return;
        }
        String sessionId = session.getSessionId();
        if (outcome.correction() != null) {
            boolean sent = notifier.sendCommand(sessionId, outcome.client(), outcome.correction());
            if (sent) {
                logger.debug("🎯 {} sent in session {} ({} @ {}ms)", outcome.correction().action().wire(),
                        sessionId, outcome.correction().trackId(), outcome.correction().positionMs());
            }
        }
        if (outcome.drift() != null) {
            notifier.sendStatus(sessionId, outcome.client(), outcome.drift(), outcome.lastSyncAt());
            notifier.sendStatus(sessionId, outcome.host(), outcome.drift(), outcome.lastSyncAt());
        }
    }

    private void ensurePeriodicSync(SyncSession session) {
        if (session.hasPeriodicSync())
            return;
        String sessionId = session.getSessionId();
        long interval = properties.getPeriodicSyncIntervalMs();
        ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(
                () -> safeRun("periodic-sync", sessionId, () -> runPeriodicSync(sessionId)),
                interval, interval, TimeUnit.MILLISECONDS);
        session.setPeriodicSyncTask(task);
        logger.debug("Periodic sync scheduled for session {} every {}ms", sessionId, interval);
    }

    // A failing session must not kill the shared scheduler thread or its repeating task.
    private void safeRun(String taskName, String sessionId, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            logger.error("💥 {} failed for session {}: {}", taskName, sessionId, e.getMessage(), e);
        }
    }

    // ==================== LOOKUPS & VALIDATION ====================

    private SyncSession requireLive(String sessionId) {
        String id = SessionCodeGenerator.normalize(sessionId);
        if (id == null || id.isEmpty())
            throw SyncException.invalid("sessionId is required");
        SyncSession session = sessions.get(id);
        if (session == null)
            throw SyncException.notFound(id);
        if (session.isExpired(clock.millis())) {
            terminate(session, EndReason.SESSION_EXPIRED);
            throw SyncException.notFound(id);
        }
        return session;
    }

    private static void ensureNotEnded(SyncSession session) {
        if (session.isEnded())
            throw SyncException.sessionEnded(session.getSessionId());
    }

    private static void requireClient(SyncSession session, String userId) {
        if (!session.isClient(userId)) {
            logger.warn("User {} is not the client of session {}", userId, session.getSessionId());
            throw SyncException.forbidden("Only the session client can do this");
        }
    }

    private static void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty())
            throw SyncException.invalid("userId cannot be null or empty");
    }

    @PreDestroy
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            logger.info("Shutting down SessionManager ({} live sessions)", sessions.size());
            sessions.values().forEach(s -> {
                s.cancelPeriodicSync();
                s.cancelHostGrace();
                s.setExpiryTask(null);
            });
        }
    }

    // ==================== HELPERS ====================

    private record SyncOutcome(PeerRef host, PeerRef client, Correction correction, DriftReport drift,
            Long lastSyncAt) {
        static final SyncOutcome NONE = new SyncOutcome(null, null, null, null, null);

        boolean isEmpty() {
            return correction == null && drift == null;
        }
    }
}
