package com.rebenew.tandem.syncserver.core;

import com.rebenew.tandem.syncserver.model.Correction;
import com.rebenew.tandem.syncserver.model.CorrectionAction;
import com.rebenew.tandem.syncserver.model.DriftReport;
import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;
import com.rebenew.tandem.syncserver.model.SyncQuality;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncEngineTest {

    private static final long T = 1_700_000_000_000L;

    private final SyncEngine engine = new SyncEngine(100, 500, 3000);

    private static PlaybackSnapshot snap(String track, long position, boolean playing, long at) {
        return new PlaybackSnapshot(track, position, playing, at);
    }

    @Test
    void shouldSeekImmediatelyWhenClientIsFarBehind() {
        PlaybackSnapshot host = snap("A", 45_000, true, T);
        PlaybackSnapshot client = snap("A", 45_200, true, T + 5_000);

        Correction correction = engine.evaluate(host, client, 0, T + 5_000);

        assertNotNull(correction);
        assertEquals(CorrectionAction.SEEK, correction.action());
        assertEquals("A", correction.trackId());
        assertEquals(50_000, correction.positionMs());
        assertEquals(Correction.Urgency.IMMEDIATE, correction.urgency());
        assertTrue(correction.playing());

        DriftReport drift = engine.measure(host, client, 0, T + 5_000);
        assertEquals(-4_800, drift.driftMs());
        assertEquals(SyncQuality.POOR, drift.quality());
    }

    @Test
    void shouldLeaveSmallDriftAlone() {
        PlaybackSnapshot host = snap("A", 45_000, true, T);
        PlaybackSnapshot client = snap("A", 49_700, true, T + 5_000);

        assertNull(engine.evaluate(host, client, 0, T + 5_000));

        DriftReport drift = engine.measure(host, client, 0, T + 5_000);
        assertEquals(-300, drift.driftMs());
        assertEquals(SyncQuality.GOOD, drift.quality());
    }

    @Test
    void shouldSeekGraduallyInFairBand() {
        PlaybackSnapshot host = snap("A", 10_000, true, T);
        PlaybackSnapshot client = snap("A", 11_000, true, T);

        Correction correction = engine.evaluate(host, client, 0, T);

        assertEquals(CorrectionAction.SEEK, correction.action());
        assertEquals(10_000, correction.positionMs());
        assertTrue(correction.isGradual());
    }

    @Test
    void shouldNeverProjectPausedHost() {
        PlaybackSnapshot host = snap("A", 30_000, false, T);
        PlaybackSnapshot client = snap("A", 30_000, false, T);

        for (long elapsed : new long[]{0, 1_000, 60_000, 3_600_000}) {
            assertNull(engine.evaluate(host, client, 0, T + elapsed));
            assertEquals(0, engine.measure(host, client, 0, T + elapsed).driftMs());
        }
        assertEquals(30_000, engine.forcedSync(host, 0, T + 60_000).positionMs());
    }

    @Test
    void shouldEmitNothingWithoutBothSnapshots() {
        PlaybackSnapshot host = snap("A", 5_000, true, T);
        for (long offset = -5_000; offset <= 5_000; offset += 1_250) {
            assertNull(engine.evaluate(host, null, offset, T + 10_000));
            assertNull(engine.evaluate(null, host, offset, T + 10_000));
            assertNull(engine.measure(host, null, offset, T));
        }
    }

    @Test
    void shouldProjectPlayingClientToEvaluationTime() {
        PlaybackSnapshot host = snap("A", 10_000, true, T);
        PlaybackSnapshot client = snap("A", 12_000, true, T + 2_000);

        assertNull(engine.evaluate(host, client, 0, T + 60_000));
        assertEquals(0, engine.measure(host, client, 0, T + 60_000).driftMs());

        PlaybackSnapshot lagging = snap("A", 11_000, true, T + 2_000);
        assertEquals(-1_000, engine.measure(host, lagging, 0, T + 60_000).driftMs());
        Correction correction = engine.evaluate(host, lagging, 0, T + 60_000);
        assertEquals(70_000, correction.positionMs());
        assertTrue(correction.isGradual());

        PlaybackSnapshot pausedClient = snap("A", 12_000, false, T + 2_000);
        assertEquals(CorrectionAction.PLAY, engine.evaluate(host, pausedClient, 0, T + 60_000).action());
    }

    @Test
    void shouldSwitchTrackRegardlessOfDrift() {
        PlaybackSnapshot host = snap("A", 20_000, true, T);
        for (long drift = -10_000; drift <= 10_000; drift += 500) {
            PlaybackSnapshot client = snap("B", Math.max(0, 20_000 + drift), false, T);

            Correction correction = engine.evaluate(host, client, 0, T);

            assertEquals(CorrectionAction.SWITCH_TRACK, correction.action());
            assertEquals("A", correction.trackId());
            assertEquals(20_000, correction.positionMs());
            assertEquals(Correction.Urgency.IMMEDIATE, correction.urgency());
        }
        assertEquals(SyncQuality.POOR, engine.measure(host, snap("B", 20_000, true, T), 0, T).quality());
    }

    @Test
    void shouldFixPlayStateBeforeDrift() {
        PlaybackSnapshot playingHost = snap("A", 20_000, true, T);
        PlaybackSnapshot pausedClient = snap("A", 20_000, false, T);
        Correction play = engine.evaluate(playingHost, pausedClient, 0, T);
        assertEquals(CorrectionAction.PLAY, play.action());
        assertEquals(20_000, play.positionMs());

        PlaybackSnapshot pausedHost = snap("A", 20_000, false, T);
        PlaybackSnapshot playingFarClient = snap("A", 90_000, true, T);
        Correction pause = engine.evaluate(pausedHost, playingFarClient, 0, T);
        assertEquals(CorrectionAction.PAUSE, pause.action());
        assertFalse(pause.playing());
    }

    @Test
    void shouldEscalateMonotonicallyWithDrift() {
        PlaybackSnapshot host = snap("A", 100_000, true, T);
        for (int sign : new int[]{1, -1}) {
            int previous = 0;
            for (long magnitude = 0; magnitude <= 6_000; magnitude += 50) {
                PlaybackSnapshot client = snap("A", 100_000 + sign * magnitude, true, T);
                int severity = severity(engine.evaluate(host, client, 0, T));
                assertTrue(severity >= previous, "severity dropped at drift " + sign * magnitude);
                previous = severity;
            }
            assertEquals(2, previous);
        }
    }

    @Test
    void shouldSwitchBandsAtThresholds() {
        PlaybackSnapshot host = snap("A", 100_000, true, T);

        assertNull(engine.evaluate(host, snap("A", 100_499, true, T), 0, T));
        assertTrue(engine.evaluate(host, snap("A", 100_500, true, T), 0, T).isGradual());
        assertTrue(engine.evaluate(host, snap("A", 97_001, true, T), 0, T).isGradual());
        assertFalse(engine.evaluate(host, snap("A", 97_000, true, T), 0, T).isGradual());

        assertEquals(SyncQuality.EXCELLENT, engine.classify(99));
        assertEquals(SyncQuality.GOOD, engine.classify(-100));
        assertEquals(SyncQuality.FAIR, engine.classify(2_999));
        assertEquals(SyncQuality.POOR, engine.classify(-3_000));
    }

    @Test
    void shouldApplyClientOffsetToTarget() {
        PlaybackSnapshot host = snap("A", 40_000, true, T);
        PlaybackSnapshot client = snap("A", 41_000, true, T);

        assertNull(engine.evaluate(host, client, 1_000, T));

        Correction correction = engine.evaluate(host, client, -2_000, T);
        assertEquals(38_000, correction.positionMs());
        assertFalse(correction.isGradual());
    }

    @Test
    void shouldClampTargetAtZero() {
        PlaybackSnapshot host = snap("A", 1_000, true, T);
        PlaybackSnapshot client = snap("B", 0, true, T);

        assertEquals(0, engine.evaluate(host, client, -5_000, T).positionMs());
        assertEquals(0, engine.forcedSync(host, -5_000, T).positionMs());
    }

    @Test
    void shouldForceSwitchToProjectedHostPosition() {
        PlaybackSnapshot host = snap("A", 60_000, true, T);

        Correction correction = engine.forcedSync(host, 0, T + 2_000);

        assertEquals(CorrectionAction.SWITCH_TRACK, correction.action());
        assertEquals("A", correction.trackId());
        assertEquals(62_000, correction.positionMs());
        assertTrue(correction.playing());
        assertEquals(T + 2_000, correction.emittedAtMs());
        assertNull(engine.forcedSync(null, 0, T));
    }

    @Test
    void shouldBeDeterministic() {
        PlaybackSnapshot host = snap("A", 12_345, true, T);
        PlaybackSnapshot client = snap("A", 8_000, true, T + 700);

        assertEquals(engine.evaluate(host, client, 250, T + 900), engine.evaluate(host, client, 250, T + 900));
        assertEquals(engine.measure(host, client, 250, T + 900), engine.measure(host, client, 250, T + 900));
    }

    @Test
    void shouldRejectInvertedBands() {
        assertThrows(IllegalArgumentException.class, () -> new SyncEngine(500, 100, 3000));
        assertThrows(IllegalArgumentException.class, () -> new SyncEngine(100, 3000, 500));
        assertThrows(IllegalArgumentException.class, () -> new SyncEngine(-1, 500, 3000));
    }

    private static int severity(Correction correction) {
        if (correction == null)
            return 0;
        return correction.isGradual() ? 1 : 2;
    }
}
