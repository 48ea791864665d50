package com.rebenew.tandem.syncserver.model;

/**
 * Outcome of a successful join. The forced correction, if any, has already
 * been handed to the notifier.
 */
public record JoinResult(
        String sessionId,
        String hostName,
        long expiresAt,
        Correction initialSync
) {
}
