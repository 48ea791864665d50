package com.rebenew.tandem.syncserver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "tandem.sync")
public class SyncProperties {

    /**
     * Fixed session lifetime. expiresAt is always createdAt plus this value.
     */
    private long sessionTimeoutMs = 14_400_000L;

    /**
     * Interval of the server-side periodic evaluation for each active session.
     */
    private long periodicSyncIntervalMs = 120_000L;

    /**
     * Window a disconnected host has to come back, capped to the remaining session lifetime.
     */
    private long hostGraceMs = 60_000L;

    /**
     * Global concurrent-session cap. 0 disables the limit.
     */
    private int maxSessions = 0;

    /**
     * Length of the human-enterable session code.
     */
    private int sessionCodeLength = 6;

    /**
     * Drift below this is reported as excellent.
     */
    private long excellentThresholdMs = 100L;

    /**
     * Drift at or above this needs a gradual correction.
     */
    private long gradualThresholdMs = 500L;

    /**
     * Drift at or above this needs an immediate seek.
     */
    private long immediateThresholdMs = 3_000L;

    /**
     * Symmetric bound for the client's manual offset.
     */
    private long maxOffsetMs = 5_000L;

    /**
     * Threads of the scheduler shared by periodic sync, grace and expiry timers.
     */
    private int schedulerThreads = 2;
}
