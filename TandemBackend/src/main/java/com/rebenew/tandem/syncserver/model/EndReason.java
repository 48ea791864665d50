package com.rebenew.tandem.syncserver.model;

public enum EndReason {
    HOST_DISCONNECTED("host_disconnected"),
    SESSION_EXPIRED("session_expired"),
    HOST_ENDED("host_ended");

    private final String wire;

    EndReason(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
