package com.rebenew.tandem.syncserver.websocket;

import com.rebenew.tandem.syncserver.model.SyncMsg;

// Message types a peer may send.
enum InboundType {
    JOIN_SESSION(SyncMsg.JOIN_SESSION),
    PLAYBACK_STATE(SyncMsg.PLAYBACK_STATE),
    CLIENT_STATE(SyncMsg.CLIENT_STATE),
    REQUEST_SYNC(SyncMsg.REQUEST_SYNC),
    UPDATE_OFFSET(SyncMsg.UPDATE_OFFSET),
    END_SESSION(SyncMsg.END_SESSION),
    HEARTBEAT(SyncMsg.HEARTBEAT);

    private final String wire;

    InboundType(String wire) {
        this.wire = wire;
    }

    static InboundType fromWire(String type) {
        if (type == null)
            return null;
        for (InboundType t : values()) {
            if (t.wire.equals(type))
                return t;
        }
        return null;
    }
}
