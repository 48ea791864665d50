package com.rebenew.tandem.syncserver.model;

/**
 * Derived, never stored. Positive driftMs means the client is ahead.
 */
public record DriftReport(long driftMs, SyncQuality quality) {

    public long magnitudeMs() {
        return Math.abs(driftMs);
    }
}
