package com.rebenew.tandem.syncserver.model;

/**
 * Identity of a peer plus the live connection currently representing it.
 * The connectionId is replaced on reconnect, the userId never changes.
 * A null connectionId means the peer is not connected right now.
 */
public record PeerRef(String userId, String connectionId) {

    public PeerRef {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId cannot be null or empty");
        }
    }

    public static PeerRef offline(String userId) {
        return new PeerRef(userId, null);
    }

    public PeerRef withConnection(String newConnectionId) {
        return new PeerRef(userId, newConnectionId);
    }

    public boolean isConnected() {
        return connectionId != null;
    }

    public boolean isUser(String otherUserId) {
        return userId.equals(otherUserId);
    }

    public boolean isConnection(String otherConnectionId) {
        return connectionId != null && connectionId.equals(otherConnectionId);
    }
}
