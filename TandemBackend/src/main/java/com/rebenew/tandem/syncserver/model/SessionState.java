package com.rebenew.tandem.syncserver.model;

// Lifecycle of a sync session: IDLE --join--> ACTIVE --end/expire/hostTimeout--> ENDED.

public enum SessionState {
    IDLE,    // Host registered, waiting for a client
    ACTIVE,  // Client joined, periodic sync running
    ENDED    // Terminal
}
