package com.rebenew.tandem.syncserver.model;

/**
 * Decision emitted towards the client to realign it with the host.
 *
 * @param playing play state the client should end up in (the host's)
 * @param urgency GRADUAL only for seeks in the fair band; the client may
 *                interpolate those instead of jumping
 */
public record Correction(
        CorrectionAction action,
        String trackId,
        long positionMs,
        long emittedAtMs,
        boolean playing,
        Urgency urgency
) {
    public enum Urgency {
        GRADUAL,
        IMMEDIATE
    }

    public static Correction immediate(CorrectionAction action, String trackId, long positionMs,
            long emittedAtMs, boolean playing) {
        return new Correction(action, trackId, positionMs, emittedAtMs, playing, Urgency.IMMEDIATE);
    }

    public boolean isGradual() {
        return urgency == Urgency.GRADUAL;
    }
}
