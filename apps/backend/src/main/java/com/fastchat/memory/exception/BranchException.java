package com.fastchat.memory.exception;

import java.util.Map;

/**
 * Deterministic branch/message failures. Never retried.
 */
public class BranchException extends MemoryException {

    public BranchException(String message, Map<String, Object> context) {
        this(MemoryErrorCode.BRANCH_ERROR, message, context);
    }

    public BranchException(MemoryErrorCode code, String message, Map<String, Object> context) {
        super(code, message, context);
    }

    public static BranchException originMessageNotFound(String originMessageId) {
        return new BranchException(MemoryErrorCode.NOT_FOUND, "Origin message not found",
                Map.of("originMessageId", originMessageId));
    }

    public static BranchException messageNotFound(String messageId) {
        return new BranchException(MemoryErrorCode.NOT_FOUND, "Message not found",
                Map.of("messageId", messageId));
    }

    public static BranchException branchNotFound(String branchId) {
        return new BranchException(MemoryErrorCode.NOT_FOUND, "Branch not found",
                Map.of("branchId", branchId));
    }

    public static BranchException sessionNotFound(String sessionId) {
        return new BranchException(MemoryErrorCode.NOT_FOUND, "Session not found",
                Map.of("sessionId", sessionId));
    }

    public static BranchException wrongSession(String sessionId, String branchId) {
        return new BranchException(MemoryErrorCode.CONFLICT, "Branch does not belong to this session",
                Map.of("sessionId", sessionId, "branchId", branchId));
    }
}
