package com.fastchat.memory.api.dto;

/**
 * One user turn.
 *
 * @param branchId null targets the session's active branch, or main when none is active
 * @param options  context window overrides; null uses defaults
 */
public record ChatTurnRequest(
        String connectionId,
        String sessionId,
        String content,
        String branchId,
        ModelOptions modelOptions,
        ContextOptions options
) { }
