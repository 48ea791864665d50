package com.rebenew.tandem.syncserver.model;

public record JoinSessionResponse(String sessionId, String role, String hostName, long expiresAt) {

    public static JoinSessionResponse of(JoinResult result) {
        return new JoinSessionResponse(result.sessionId(), PeerRole.CLIENT.wire(), result.hostName(),
                result.expiresAt());
    }
}
