package com.rebenew.tandem.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.Map;

/**
 * Unified WebSocket envelope. Every payload travels in the single 'data' field.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    // Inbound
    public static final String JOIN_SESSION = "join_session";
    public static final String PLAYBACK_STATE = "playback_state";
    public static final String CLIENT_STATE = "client_state";
    public static final String REQUEST_SYNC = "request_sync";
    public static final String UPDATE_OFFSET = "update_offset";
    public static final String END_SESSION = "end_session";
    public static final String HEARTBEAT = "heartbeat";

    // Outbound
    public static final String SYNC_COMMAND = "sync_command";
    public static final String SYNC_STATUS = "sync_status";
    public static final String SESSION_ENDED = "session_ended";
    public static final String ACK = "ack";
    public static final String ERROR = "error";

    private String type;
    private String sessionId;
    private String userId;
    private String correlationId;
    private Long timestamp;
    private Object data;

    // ==================== STATIC CONSTRUCTORS ====================

    public static SyncMsg syncCommand(String sessionId, Correction correction) {
        Map<String, Object> data = new HashMap<>();
        data.put("action", correction.action().wire());
        data.put("trackId", correction.trackId());
        data.put("positionMs", correction.positionMs());
        data.put("timestampMs", correction.emittedAtMs());
        data.put("playing", correction.playing());
        data.put("gradual", correction.isGradual());
        return new SyncMsg(SYNC_COMMAND, sessionId, data, correction.emittedAtMs());
    }

    public static SyncMsg syncStatus(String sessionId, DriftReport report, Long lastSyncAtMs, long now) {
        Map<String, Object> data = new HashMap<>();
        data.put("driftMs", report.driftMs());
        data.put("quality", report.quality().wire());
        data.put("lastSyncAtMs", lastSyncAtMs);
        return new SyncMsg(SYNC_STATUS, sessionId, data, now);
    }

    public static SyncMsg sessionEnded(String sessionId, EndReason reason, long now) {
        return new SyncMsg(SESSION_ENDED, sessionId, Map.of("reason", reason.wire()), now);
    }

    public static SyncMsg ack(boolean success, String reason, String correlationId, long now) {
        SyncMsg msg = new SyncMsg(ACK, null, Map.of("success", success, "reason", reason), now);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg error(String code, String message, String correlationId, long now) {
        Map<String, Object> data = new HashMap<>();
        data.put("code", code);
        data.put("message", message);
        SyncMsg msg = new SyncMsg(ERROR, null, data, now);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    private SyncMsg(String type, String sessionId, Object data, long timestamp) {
        this.type = type;
        this.sessionId = sessionId;
        this.data = data;
        this.timestamp = timestamp;
    }

    // Empty constructor for Jackson
    public SyncMsg() {
    }

    // ==================== DATA ACCESS ====================

    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    public String getStringData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public Long getLongData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Number)
            return ((Number) value).longValue();
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Boolean getBoolData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Boolean)
            return (Boolean) value;
        if (value instanceof String)
            return Boolean.parseBoolean((String) value);
        return null;
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', sessionId='%s', userId='%s', timestamp=%d}",
                type, sessionId, userId, timestamp);
    }
}
