package com.rebenew.tandem.syncserver.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.tandem.syncserver.model.Correction;
import com.rebenew.tandem.syncserver.model.CorrectionAction;
import com.rebenew.tandem.syncserver.model.PlaybackSnapshot;
import com.rebenew.tandem.syncserver.model.SyncMsg;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrectionExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final class FakePlayback implements MediaPlayback {
        final List<String> calls = new ArrayList<>();
        boolean authorized = true;
        int authAttempts;

        @Override
        public boolean authenticate() {
            authAttempts++;
            return authorized;
        }

        @Override
        public PlaybackSnapshot getCurrentPlayback() {
            return null;
        }

        @Override
        public void play(String trackId) {
            calls.add("play:" + trackId);
        }

        @Override
        public void pause() {
            calls.add("pause");
        }

        @Override
        public void seek(long positionMs) {
            calls.add("seek:" + positionMs);
        }
    }

    private SyncMsg decode(Correction correction) throws Exception {
        String json = objectMapper.writeValueAsString(SyncMsg.syncCommand("K3Q9ZD", correction));
        return objectMapper.readValue(json, SyncMsg.class);
    }

    @Test
    void shouldSwitchTrackAndStayPausedLikeHost() throws Exception {
        FakePlayback playback = new FakePlayback();
        CorrectionExecutor executor = new CorrectionExecutor(playback);

        boolean applied = executor.handle(decode(
                Correction.immediate(CorrectionAction.SWITCH_TRACK, "B", 62_000, 10L, false)));

        assertTrue(applied);
        assertEquals(List.of("play:B", "seek:62000", "pause"), playback.calls);
    }

    @Test
    void shouldSeekOnDrift() throws Exception {
        FakePlayback playback = new FakePlayback();
        CorrectionExecutor executor = new CorrectionExecutor(playback);

        executor.handle(decode(new Correction(CorrectionAction.SEEK, "A", 50_000, 10L, true,
                Correction.Urgency.GRADUAL)));
        executor.apply(Correction.immediate(CorrectionAction.PLAY, "A", 51_000, 11L, true));
        executor.apply(Correction.immediate(CorrectionAction.PAUSE, "A", 51_000, 12L, false));

        assertEquals(List.of("seek:50000", "play:A", "seek:51000", "pause"), playback.calls);
        assertEquals(1, playback.authAttempts);
    }

    @Test
    void shouldIgnoreOtherMessages() throws Exception {
        FakePlayback playback = new FakePlayback();
        CorrectionExecutor executor = new CorrectionExecutor(playback);

        assertFalse(executor.handle(SyncMsg.ack(true, "joined", null, 0L)));
        assertFalse(executor.handle(objectMapper.readValue(
                "{\"type\":\"sync_command\",\"data\":{\"action\":\"rewind\",\"positionMs\":1}}", SyncMsg.class)));
        assertFalse(executor.handle(null));
        assertTrue(playback.calls.isEmpty());
    }

    @Test
    void shouldSkipWhenNotAuthenticated() {
        FakePlayback playback = new FakePlayback();
        playback.authorized = false;
        CorrectionExecutor executor = new CorrectionExecutor(playback);

        assertFalse(executor.apply(Correction.immediate(CorrectionAction.SEEK, "A", 1_000, 0L, true)));
        assertTrue(playback.calls.isEmpty());

        playback.authorized = true;
        assertTrue(executor.apply(Correction.immediate(CorrectionAction.SEEK, "A", 1_000, 0L, true)));
        assertEquals(List.of("seek:1000"), playback.calls);
    }
}
