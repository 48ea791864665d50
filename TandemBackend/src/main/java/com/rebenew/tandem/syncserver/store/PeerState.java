package com.rebenew.tandem.syncserver.store;

import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;

/**
 * Latest known playback state of a session's two peers plus the client offset.
 * Replaced wholesale on every update; no history is kept.
 */
public record PeerState(
        PlaybackSnapshot hostSnapshot,
        PlaybackSnapshot clientSnapshot,
        long clientOffsetMs
) {
    public static final PeerState EMPTY = new PeerState(null, null, 0L);

    public PeerState withHostSnapshot(PlaybackSnapshot snapshot) {
        return new PeerState(snapshot, clientSnapshot, clientOffsetMs);
    }

    public PeerState withClientSnapshot(PlaybackSnapshot snapshot) {
        return new PeerState(hostSnapshot, snapshot, clientOffsetMs);
    }

    public PeerState withClientOffset(long offsetMs) {
        return new PeerState(hostSnapshot, clientSnapshot, offsetMs);
    }
}
