package com.fastchat.memory.util;

import com.fastchat.memory.api.dto.Message;

/**
 * Length-based token heuristic. A producer-recorded estimate always wins.
 */
public final class TokenEstimator {
    private TokenEstimator() {}

    public static int estimate(Message message, int charsPerToken) {
        return message.storedTokenEstimate().orElseGet(() -> estimate(message.getContent(), charsPerToken));
    }

    public static int estimate(String text, int charsPerToken) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int per = Math.max(1, charsPerToken);
        return (text.length() + per - 1) / per;
    }
}
