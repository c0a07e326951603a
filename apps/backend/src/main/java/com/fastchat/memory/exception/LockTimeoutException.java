package com.fastchat.memory.exception;

import java.time.Duration;
import java.util.Map;

public class LockTimeoutException extends MemoryException {

    public LockTimeoutException(String sessionId, Duration waited) {
        super(MemoryErrorCode.LOCK_TIMEOUT, "Failed to acquire session lock, please retry",
                Map.of("sessionId", sessionId, "waitedMs", waited.toMillis()));
    }
}
