package com.rebenew.tandem.syncserver.exception;

/**
 * Control-surface failure with a stable wire code.
 */
public class SyncException extends RuntimeException {

    public static final String SESSION_NOT_FOUND = "session_not_found";
    public static final String SESSION_FULL = "session_full";
    public static final String SESSION_ENDED = "session_ended";
    public static final String CAPACITY_EXCEEDED = "capacity_exceeded";
    public static final String FORBIDDEN = "forbidden";
    public static final String INVALID_REQUEST = "invalid_request";

    private final ErrorKind kind;
    private final String code;

    public SyncException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public static SyncException notFound(String sessionId) {
        return new SyncException(ErrorKind.NOT_FOUND, SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }

    public static SyncException sessionFull(String sessionId) {
        return new SyncException(ErrorKind.CONFLICT, SESSION_FULL, "Session is full: " + sessionId);
    }

    public static SyncException sessionEnded(String sessionId) {
        return new SyncException(ErrorKind.NOT_FOUND, SESSION_ENDED, "Session has ended: " + sessionId);
    }

    public static SyncException capacityExceeded(int maxSessions) {
        return new SyncException(ErrorKind.CONFLICT, CAPACITY_EXCEEDED,
                "Concurrent session limit reached: " + maxSessions);
    }

    public static SyncException forbidden(String message) {
        return new SyncException(ErrorKind.FORBIDDEN, FORBIDDEN, message);
    }

    public static SyncException invalid(String message) {
        return new SyncException(ErrorKind.INVALID, INVALID_REQUEST, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
