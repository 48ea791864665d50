package com.rebenew.tandem.syncserver.model;

import java.util.concurrent.ScheduledFuture;

/**
 * Aggregate for one host/client pairing. Holds identity, membership and the
 * lifecycle timers; playback snapshots live in the PeerStateStore.
 * <p>
 * The object monitor is the session's critical section: the manager
 * synchronizes on the session for every mutation plus the evaluation that
 * follows it.
 */
public class SyncSession {
    // IDENTITY
    private final String sessionId;
    private final long createdAt;
    private final long expiresAt;

    // MEMBERSHIP
    private volatile PeerRef host;
    private volatile PeerRef client;

    // LIFECYCLE
    private volatile SessionState state = SessionState.IDLE;
    private volatile EndReason endReason;
    private volatile Long lastSyncAt;
    private volatile long lastHostActivity;

    // TIMERS
    private ScheduledFuture<?> periodicSyncTask;
    private ScheduledFuture<?> hostGraceTask;
    private ScheduledFuture<?> expiryTask;

    public SyncSession(String sessionId, String hostUserId, long createdAt, long timeoutMs) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("sessionId cannot be null or empty");
        }
        this.sessionId = sessionId;
        this.host = PeerRef.offline(hostUserId);
        this.createdAt = createdAt;
        this.expiresAt = createdAt + timeoutMs;
        this.lastHostActivity = createdAt;
    }

    // ========== MEMBERSHIP ==========

    public boolean isHost(String userId) {
        return host.isUser(userId);
    }

    public boolean isClient(String userId) {
        PeerRef c = client;
        return c != null && c.isUser(userId);
    }

    public boolean hasClient() {
        return client != null;
    }

    /**
     * Registers the client. The slot is taken once per lifetime; the same
     * user registering again is accepted as a rejoin.
     *
     * @return false if a different client already holds the slot
     */
    public synchronized boolean registerClient(String userId) {
        if (client != null)
            return client.isUser(userId);
        this.client = PeerRef.offline(userId);
        if (state == SessionState.IDLE)
            this.state = SessionState.ACTIVE;
        return true;
    }

    public synchronized void attachHost(String connectionId, long now) {
        this.host = host.withConnection(connectionId);
        this.lastHostActivity = now;
    }

    public synchronized void attachClient(String connectionId) {
        if (client == null)
            throw new IllegalStateException("No client registered in session " + sessionId);
        this.client = client.withConnection(connectionId);
    }

    /**
     * Clears whichever peer is bound to the given connection.
     *
     * @return the role that lost its connection, or null if the connection
     *         is stale (already replaced by a reconnect)
     */
    public synchronized PeerRole detach(String connectionId, long now) {
        if (host.isConnection(connectionId)) {
            this.host = PeerRef.offline(host.userId());
            this.lastHostActivity = now;
            return PeerRole.HOST;
        }
        PeerRef c = client;
        if (c != null && c.isConnection(connectionId)) {
            this.client = PeerRef.offline(c.userId());
            return PeerRole.CLIENT;
        }
        return null;
    }

    public boolean isHostConnection(String connectionId) {
        return host.isConnection(connectionId);
    }

    public boolean isClientConnection(String connectionId) {
        PeerRef c = client;
        return c != null && c.isConnection(connectionId);
    }

    public void touchHost(long now) {
        this.lastHostActivity = now;
    }

    // ========== LIFECYCLE ==========

    public boolean isExpired(long now) {
        return now >= expiresAt;
    }

    public boolean isEnded() {
        return state == SessionState.ENDED;
    }

    public long remainingMs(long now) {
        return Math.max(0L, expiresAt - now);
    }

    /**
     * Moves the session to ENDED and cancels all its timers. A timer task that
     * is already running finishes and observes ENDED afterwards.
     *
     * @return false if the session was already ended
     */
    public synchronized boolean end(EndReason reason) {
        if (state == SessionState.ENDED)
            return false;
        this.state = SessionState.ENDED;
        this.endReason = reason;
        cancelPeriodicSync();
        cancelHostGrace();
        cancel(expiryTask);
        expiryTask = null;
        return true;
    }

    // ========== TIMERS ==========

    public synchronized void setPeriodicSyncTask(ScheduledFuture<?> task) {
        cancelPeriodicSync();
        this.periodicSyncTask = task;
    }

    public synchronized boolean hasPeriodicSync() {
        return periodicSyncTask != null;
    }

    public synchronized void cancelPeriodicSync() {
        cancel(periodicSyncTask);
        periodicSyncTask = null;
    }

    public synchronized void setHostGraceTask(ScheduledFuture<?> task) {
        cancelHostGrace();
        this.hostGraceTask = task;
    }

    public synchronized boolean hasHostGrace() {
        return hostGraceTask != null;
    }

    public synchronized void cancelHostGrace() {
        cancel(hostGraceTask);
        hostGraceTask = null;
    }

    public synchronized void setExpiryTask(ScheduledFuture<?> task) {
        cancel(expiryTask);
        this.expiryTask = task;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null && !task.isDone())
            task.cancel(false);
    }

    // ========== GETTERS / SETTERS ==========

    public String getSessionId() {
        return sessionId;
    }

    public PeerRef getHost() {
        return host;
    }

    public PeerRef getClient() {
        return client;
    }

    public SessionState getState() {
        return state;
    }

    public EndReason getEndReason() {
        return endReason;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public Long getLastSyncAt() {
        return lastSyncAt;
    }

    public void setLastSyncAt(Long lastSyncAt) {
        this.lastSyncAt = lastSyncAt;
    }

    public long getLastHostActivity() {
        return lastHostActivity;
    }

    @Override
    public String toString() {
        return "SyncSession{" +
                "sessionId='" + sessionId + '\'' +
                ", host=" + host +
                ", client=" + client +
                ", state=" + state +
                ", expiresAt=" + expiresAt +
                ", lastSyncAt=" + lastSyncAt +
                '}';
    }
}
