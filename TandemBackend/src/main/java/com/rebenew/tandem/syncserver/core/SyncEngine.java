package com.rebenew.tandem.syncserver.core;

import com.rebenew.tandem.syncserver.config.SyncProperties;
import com.rebenew.tandem.syncserver.model.Correction;
import com.rebenew.tandem.syncserver.model.CorrectionAction;
import com.rebenew.tandem.syncserver.model.DriftReport;
import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;
import com.rebenew.tandem.syncserver.model.SyncQuality;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Drift computation and correction policy. Pure: the result depends only on
 * the arguments and the configured bands, so it can run under the session
 * lock and be tested without mocks.
 * <p>
 * Precedence, highest first: track mismatch, play-state mismatch, position drift.
 */
@Component
public class SyncEngine {

    private final long excellentThresholdMs;
    private final long gradualThresholdMs;
    private final long immediateThresholdMs;

    @Autowired
    public SyncEngine(SyncProperties properties) {
        this(properties.getExcellentThresholdMs(), properties.getGradualThresholdMs(),
                properties.getImmediateThresholdMs());
    }

    public SyncEngine(long excellentThresholdMs, long gradualThresholdMs, long immediateThresholdMs) {
        if (excellentThresholdMs < 0 || gradualThresholdMs < excellentThresholdMs
                || immediateThresholdMs < gradualThresholdMs) {
            throw new IllegalArgumentException("Drift bands must satisfy 0 <= excellent <= gradual <= immediate");
        }
        this.excellentThresholdMs = excellentThresholdMs;
        this.gradualThresholdMs = gradualThresholdMs;
        this.immediateThresholdMs = immediateThresholdMs;
    }

    /**
     * Decides whether the client needs a correction.
     *
     * @return the correction to send, or null when nothing needs to happen
     *         (no host state, no client state, or drift inside the good band)
     */
    public Correction evaluate(PlaybackSnapshot host, PlaybackSnapshot client, long clientOffsetMs, long now) {
        if (host == null || client == null)
            return null;

        long target = targetClientPosition(host, clientOffsetMs, now);

        if (!host.trackId().equals(client.trackId())) {
            return Correction.immediate(CorrectionAction.SWITCH_TRACK, host.trackId(), target, now, host.isPlaying());
        }

        if (host.isPlaying() != client.isPlaying()) {
            CorrectionAction action = host.isPlaying() ? CorrectionAction.PLAY : CorrectionAction.PAUSE;
            return Correction.immediate(action, host.trackId(), target, now, host.isPlaying());
        }

        long drift = projectedPosition(client, now) - target;
        switch (classify(drift)) {
            case FAIR:
                return new Correction(CorrectionAction.SEEK, host.trackId(), target, now, host.isPlaying(),
                        Correction.Urgency.GRADUAL);
            case POOR:
                return Correction.immediate(CorrectionAction.SEEK, host.trackId(), target, now, host.isPlaying());
            default:
                return null;
        }
    }

    /**
     * Drift of the client against the host at {@code now}.
     *
     * @return null under the same conditions in which {@link #evaluate} has
     *         nothing to compare; a track mismatch is always reported as poor
     */
    public DriftReport measure(PlaybackSnapshot host, PlaybackSnapshot client, long clientOffsetMs, long now) {
        if (host == null || client == null)
            return null;
        long drift = projectedPosition(client, now) - targetClientPosition(host, clientOffsetMs, now);
        if (!host.trackId().equals(client.trackId()))
            return new DriftReport(drift, SyncQuality.POOR);
        return new DriftReport(drift, classify(drift));
    }

    /**
     * Full resync used when a client joins or has nothing reported yet:
     * switch to the host's track at its projected position.
     */
    public Correction forcedSync(PlaybackSnapshot host, long clientOffsetMs, long now) {
        if (host == null)
            return null;
        long target = targetClientPosition(host, clientOffsetMs, now);
        return Correction.immediate(CorrectionAction.SWITCH_TRACK, host.trackId(), target, now, host.isPlaying());
    }

    public SyncQuality classify(long driftMs) {
        long magnitude = Math.abs(driftMs);
        if (magnitude < excellentThresholdMs)
            return SyncQuality.EXCELLENT;
        if (magnitude < gradualThresholdMs)
            return SyncQuality.GOOD;
        if (magnitude < immediateThresholdMs)
            return SyncQuality.FAIR;
        return SyncQuality.POOR;
    }

    // Host position projected to now, plus the offset, never negative.
    long targetClientPosition(PlaybackSnapshot host, long clientOffsetMs, long now) {
        return Math.max(0L, projectedPosition(host, now) + clientOffsetMs);
    }

    // A paused snapshot stays where it was reported.
    static long projectedPosition(PlaybackSnapshot snapshot, long now) {
        if (!snapshot.isPlaying())
            return snapshot.positionMs();
        return snapshot.positionMs() + Math.max(0L, now - snapshot.reportedAtMs());
    }
}
