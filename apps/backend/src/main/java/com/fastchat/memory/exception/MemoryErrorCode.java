package com.fastchat.memory.exception;

import lombok.Getter;

@Getter
public enum MemoryErrorCode {
    NOT_FOUND(404, false),
    BRANCH_ERROR(400, false),
    CONFLICT(409, false),
    LOCK_TIMEOUT(409, true),
    STORE_UNAVAILABLE(503, true),
    NOT_INITIALIZED(503, true),
    STREAM_ERROR(500, false);

    private final int status;
    private final boolean retryable;

    MemoryErrorCode(int status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }
}
