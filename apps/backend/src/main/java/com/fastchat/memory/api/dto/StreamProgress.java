package com.fastchat.memory.api.dto;

/**
 * Point-in-time view of a live stream.
 */
public record StreamProgress(
        String requestId,
        String connectionId,
        String sessionId,
        String messageId,
        StreamStatus status,
        long startTime,
        long tokensReceived,
        String content
) { }
