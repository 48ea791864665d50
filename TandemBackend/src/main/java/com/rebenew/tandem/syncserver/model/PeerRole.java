package com.rebenew.tandem.syncserver.model;

// Exactly one HOST and at most one CLIENT per session.
public enum PeerRole {
    HOST("host"),
    CLIENT("client");

    private final String wire;

    PeerRole(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static PeerRole fromWire(String value) {
        if (value == null)
            return null;
        for (PeerRole role : values()) {
            if (role.wire.equalsIgnoreCase(value.trim()))
                return role;
        }
        return null;
    }
}
