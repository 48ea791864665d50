package com.rebenew.tandem.syncserver.client;

import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;

/**
 * Playback capability of a device, provided by the vendor SDK.
 * The coordinator only drives it on the client side, through
 * {@link CorrectionExecutor}; the host side only reads from it.
 */
public interface MediaPlayback {

    boolean authenticate();

    /**
     * @return the current playback, or null if nothing is playing on the device
     */
    PlaybackSnapshot getCurrentPlayback();

    /**
     * @param trackId track to start, or null to resume the current one
     */
    void play(String trackId);

    void pause();

    void seek(long positionMs);
}
