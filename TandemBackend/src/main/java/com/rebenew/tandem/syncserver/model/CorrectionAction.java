package com.rebenew.tandem.syncserver.model;

public enum CorrectionAction {
    PLAY("play"),
    PAUSE("pause"),
    SEEK("seek"),
    SWITCH_TRACK("switch_track");

    private final String wire;

    CorrectionAction(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static CorrectionAction fromWire(String value) {
        if (value == null)
            return null;
        for (CorrectionAction action : values()) {
            if (action.wire.equals(value))
                return action;
        }
        return null;
    }
}
