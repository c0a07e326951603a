package com.fastchat.memory.service.impl;

import java.util.Optional;

/**
 * Key layout shared by every store implementation.
 */
public final class MemoryKeys {

    private final String prefix;

    public MemoryKeys(String prefix) {
        this.prefix = (prefix == null || prefix.isBlank()) ? "fast-chat:memory:" : prefix;
    }

    public String session(String sessionId) {
        return prefix + "session:" + sessionId;
    }

    /** Main timeline order index of a session. */
    public String messages(String sessionId) {
        return prefix + "messages:" + sessionId;
    }

    public String message(String messageId) {
        return prefix + "message:" + messageId;
    }

    public String branch(String branchId) {
        return prefix + "branch:" + branchId;
    }

    public String branchMessages(String branchId) {
        return prefix + "branch:" + branchId + ":messages";
    }

    public String messageVersions(String rootMessageId) {
        return prefix + "messageVersions:" + rootMessageId;
    }

    public String branchHistory(String sessionId) {
        return prefix + "branchHistory:" + sessionId;
    }

    public String lock(String sessionId) {
        return prefix + "lock:session:" + sessionId;
    }

    public String index(String sessionId, Optional<String> branchId) {
        return branchId.map(this::branchMessages).orElseGet(() -> messages(sessionId));
    }

    public String prefix() {
        return prefix;
    }
}
