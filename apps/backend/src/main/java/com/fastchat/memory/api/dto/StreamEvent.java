package com.fastchat.memory.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Frame pushed to a delivery sink (WebSocket message or SSE event).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        Type type,
        String requestId,
        String sessionId,
        String messageId,
        String content,
        String error
) {
    public enum Type {
        START, TOKEN, DONE, ERROR, CANCELLED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static StreamEvent start(String requestId, String sessionId, String messageId) {
        return new StreamEvent(Type.START, requestId, sessionId, messageId, null, null);
    }

    public static StreamEvent token(String requestId, String sessionId, String messageId, String token) {
        return new StreamEvent(Type.TOKEN, requestId, sessionId, messageId, token, null);
    }

    public static StreamEvent done(String requestId, String sessionId, String messageId, String fullContent) {
        return new StreamEvent(Type.DONE, requestId, sessionId, messageId, fullContent, null);
    }

    public static StreamEvent error(String requestId, String sessionId, String messageId, String error) {
        return new StreamEvent(Type.ERROR, requestId, sessionId, messageId, null, error);
    }

    public static StreamEvent cancelled(String requestId, String sessionId, String messageId) {
        return new StreamEvent(Type.CANCELLED, requestId, sessionId, messageId, null, null);
    }
}
