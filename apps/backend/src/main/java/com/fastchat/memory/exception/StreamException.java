package com.fastchat.memory.exception;

import java.util.Map;

public class StreamException extends MemoryException {

    public StreamException(String message, String requestId, Throwable cause) {
        super(MemoryErrorCode.STREAM_ERROR, message,
                requestId == null ? Map.of() : Map.of("requestId", requestId), cause);
    }
}
