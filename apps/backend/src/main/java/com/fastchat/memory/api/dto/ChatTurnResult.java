package com.fastchat.memory.api.dto;

/**
 * @param requestId null when the model answered without streaming
 */
public record ChatTurnResult(
        String sessionId,
        String userMessageId,
        String assistantMessageId,
        String requestId,
        MemoryContext context
) { }
