package com.rebenew.tandem.syncserver.exception;

public enum ErrorKind {
    NOT_FOUND,  // session absent or expired; caller may create/join again
    FORBIDDEN,  // role or identity mismatch
    CONFLICT,   // slot occupied, capacity reached
    INVALID,    // malformed message or value
    TRANSIENT   // delivery to a disconnected peer
}
