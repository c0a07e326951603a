package com.fastchat.memory.api.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class ContextOptions {
    /** Null falls back to fastchat.memory.context.max-messages. */
    Integer maxMessages;
    /** Null means no token budget. */
    Integer maxTokens;
    String branchId;
    @Builder.Default
    boolean includeSystemPrompt = true;
    @Builder.Default
    boolean preferRecent = true;
    /** Prepend the ancestor timeline up to the branch origin. */
    @Builder.Default
    boolean includeAncestry = false;

    public static ContextOptions defaults() {
        return ContextOptions.builder().build();
    }

    public Optional<String> branch() {
        return Optional.ofNullable(branchId);
    }
}
