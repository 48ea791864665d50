package com.rebenew.tandem.syncserver.websocket;

import com.rebenew.tandem.syncserver.model.PeerRole;

/**
 * What a live connection has authenticated as.
 */
public record PeerBinding(String sessionId, PeerRole role, String userId) {
}
