package com.fastchat.memory.api.dto;

public enum StreamStatus {
    STREAMING,
    /** Upstream finished; the reply is being persisted. */
    COMPLETING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
