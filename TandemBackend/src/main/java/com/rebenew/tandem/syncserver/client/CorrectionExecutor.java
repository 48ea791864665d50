package com.rebenew.tandem.syncserver.client;

import com.rebenew.tandem.syncserver.model.Correction;
import com.rebenew.tandem.syncserver.model.CorrectionAction;
import com.rebenew.tandem.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Device-local adapter that turns a sync_command into calls on the playback SDK.
 */
public class CorrectionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CorrectionExecutor.class);

    private final MediaPlayback playback;
    private volatile boolean authenticated;

    public CorrectionExecutor(MediaPlayback playback) {
        this.playback = playback;
    }

    /**
     * Decodes and applies a sync_command envelope.
     *
     * @return false if the message is not a usable sync_command or was not applied
     */
    public boolean handle(SyncMsg msg) {
        if (msg == null || !SyncMsg.SYNC_COMMAND.equals(msg.getType())) {
            return false;
        }
        CorrectionAction action = CorrectionAction.fromWire(msg.getStringData("action"));
        Long positionMs = msg.getLongData("positionMs");
        if (action == null || positionMs == null) {
            logger.warn("Ignoring malformed sync_command: {}", msg);
            return false;
        }
        Long timestampMs = msg.getLongData("timestampMs");
        Boolean playing = msg.getBoolData("playing");
        Boolean gradual = msg.getBoolData("gradual");
        Correction correction = new Correction(action, msg.getStringData("trackId"), positionMs,
                timestampMs != null ? timestampMs : 0L,
                playing != null ? playing : action != CorrectionAction.PAUSE,
                Boolean.TRUE.equals(gradual) ? Correction.Urgency.GRADUAL : Correction.Urgency.IMMEDIATE);
        return apply(correction);
    }

    public boolean apply(Correction correction) {
        if (!ensureAuthenticated()) {
            logger.warn("Playback not authenticated, skipping {}", correction.action().wire());
            return false;
        }
        switch (correction.action()) {
            case SWITCH_TRACK:
                playback.play(correction.trackId());
                playback.seek(correction.positionMs());
                if (!correction.playing())
                    playback.pause();
                break;
            case PLAY:
                playback.play(correction.trackId());
                playback.seek(correction.positionMs());
                break;
            case PAUSE:
                playback.pause();
                break;
            case SEEK:
                playback.seek(correction.positionMs());
                break;
        }
        logger.debug("Applied {} to {} @ {}ms", correction.action().wire(), correction.trackId(),
                correction.positionMs());
        return true;
    }

    private boolean ensureAuthenticated() {
        if (!authenticated)
            authenticated = playback.authenticate();
        return authenticated;
    }
}
