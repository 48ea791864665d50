package com.rebenew.tandem.syncserver.model;

/**
 * Immutable report of one peer's playback at the moment it was captured.
 * A peer produces a new snapshot on every report; nothing is ever mutated.
 *
 * @param reportedAtMs coordinator clock time at which the report was captured
 */
public record PlaybackSnapshot(
        String trackId,
        long positionMs,
        boolean isPlaying,
        long reportedAtMs
) {
    public PlaybackSnapshot {
        if (trackId == null || trackId.trim().isEmpty()) {
            throw new IllegalArgumentException("trackId cannot be null or empty");
        }
        if (positionMs < 0) {
            positionMs = 0L;
        }
    }
}
