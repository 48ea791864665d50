package com.rebenew.tandem.syncserver.core;

import com.rebenew.tandem.syncserver.model.Correction;
import com.rebenew.tandem.syncserver.model.DriftReport;
import com.rebenew.tandem.syncserver.model.EndReason;
import com.rebenew.tandem.syncserver.model.PeerRef;

/**
 * Outbound side of the transport. Delivery to a peer without a live
 * connection is dropped, never queued.
 */
public interface PeerNotifier {

    /**
     * @return true if the message was handed to a live connection
     */
    boolean sendCommand(String sessionId, PeerRef target, Correction correction);

    boolean sendStatus(String sessionId, PeerRef target, DriftReport report, Long lastSyncAtMs);

    boolean sendSessionEnded(String sessionId, PeerRef target, EndReason reason);
}
