package com.rebenew.tandem.syncserver.model;

/**
 * Drift magnitude bands, from best to worst.
 */
public enum SyncQuality {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String wire;

    SyncQuality(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
