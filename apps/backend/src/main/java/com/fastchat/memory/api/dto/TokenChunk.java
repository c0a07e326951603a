package com.fastchat.memory.api.dto;

/**
 * Partial content emitted by a model while it is still generating.
 */
public record TokenChunk(String token) {

    public static TokenChunk of(String token) {
        return new TokenChunk(token);
    }

    public boolean isEmpty() {
        return token == null || token.isEmpty();
    }
}
