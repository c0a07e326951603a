package com.fastchat.memory.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every error raised by the memory engine.
 * {@link #isRetryable()} tells callers whether a backoff-and-retry can succeed.
 */
@Getter
public class MemoryException extends RuntimeException {

    private final MemoryErrorCode code;
    private final Map<String, Object> context;

    public MemoryException(MemoryErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public MemoryException(MemoryErrorCode code, String message, Map<String, Object> context) {
        this(code, message, context, null);
    }

    public MemoryException(MemoryErrorCode code, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public int getStatus() {
        return code.getStatus();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof MemoryException me && me.isRetryable();
    }
}
