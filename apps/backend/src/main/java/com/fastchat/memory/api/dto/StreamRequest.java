package com.fastchat.memory.api.dto;

import java.util.Objects;

/**
 * Identifies one streamed reply.
 *
 * @param connectionId    the client connection the reply is delivered to
 * @param messageId       id the final assistant message is persisted under
 * @param branchId        null for the main timeline
 * @param parentMessageId the user message being answered, may be null
 */
public record StreamRequest(
        String connectionId,
        String sessionId,
        String messageId,
        String branchId,
        String parentMessageId,
        String modelId
) {
    public StreamRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(messageId, "messageId");
    }

    public static StreamRequest of(String connectionId, String sessionId, String messageId) {
        return new StreamRequest(connectionId, sessionId, messageId, null, null, null);
    }
}
