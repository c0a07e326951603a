package com.fastchat.memory.api.dto;

import java.util.List;

/**
 * Bounded, chronologically ordered window handed to a model call.
 */
public record MemoryContext(
        List<Message> messages,
        String systemPrompt,
        Metadata metadata
) {
    public MemoryContext {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static MemoryContext empty(String sessionId, String branchId) {
        return new MemoryContext(List.of(), null, new Metadata(sessionId, branchId, 0, 0));
    }

    public record Metadata(String sessionId, String branchId, int tokenCount, int messageCount) { }
}
