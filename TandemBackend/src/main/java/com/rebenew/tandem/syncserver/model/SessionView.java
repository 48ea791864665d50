package com.rebenew.tandem.syncserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Read-only view of a session for the control surface.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionView {
    private final String sessionId;
    private final SessionState state;
    private final String hostUserId;
    private final boolean hostConnected;
    private final String clientUserId;
    private final boolean clientConnected;
    private final PlaybackSnapshot hostSnapshot;
    private final PlaybackSnapshot clientSnapshot;
    private final long clientOffsetMs;
    private final long createdAt;
    private final long expiresAt;
    private final long hostLastSeenAt;
    private final Long lastSyncAt;
    private final DriftReport drift;
}
