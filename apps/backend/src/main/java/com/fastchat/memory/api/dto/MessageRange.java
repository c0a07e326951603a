package com.fastchat.memory.api.dto;

/**
 * Window over an ordered message index. Results are always returned oldest first;
 * {@code fromEnd} selects the window relative to the newest message.
 */
public record MessageRange(long offset, long limit, boolean fromEnd) {

    private static final MessageRange ALL = new MessageRange(0, 0, false);

    public MessageRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
    }

    public static MessageRange all() {
        return ALL;
    }

    public static MessageRange of(long offset, long limit) {
        return new MessageRange(offset, limit, false);
    }

    /** The {@code count} most recent entries. */
    public static MessageRange last(long count) {
        return new MessageRange(0, count, true);
    }

    public boolean unbounded() {
        return limit == 0;
    }

    /** Inclusive start/stop pair in Redis ZRANGE index notation. */
    public long[] toIndexBounds() {
        if (fromEnd) {
            return unbounded() ? new long[]{0, -1} : new long[]{-limit, -1};
        }
        long stop = unbounded() ? -1 : offset + limit - 1;
        return new long[]{offset, stop};
    }
}
