package com.rebenew.tandem.syncserver.model;

public record CreateSessionResponse(String sessionId, String role, long expiresAt) {

    public static CreateSessionResponse of(SyncSession session) {
        return new CreateSessionResponse(session.getSessionId(), PeerRole.HOST.wire(), session.getExpiresAt());
    }
}
