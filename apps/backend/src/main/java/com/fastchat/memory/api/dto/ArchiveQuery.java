package com.fastchat.memory.api.dto;

/**
 * Filters for reading archived messages. Null fields do not filter. Results always come back
 * oldest first; {@code newestFirst} only decides which end of the timeline the window is cut from.
 *
 * @param mainOnly restricts the read to messages that belong to no branch; ignored when {@code branchId} is set
 */
public record ArchiveQuery(String branchId, boolean mainOnly, Role role, Long since,
                           long offset, Integer limit, boolean newestFirst) {

    public static ArchiveQuery all() {
        return new ArchiveQuery(null, false, null, null, 0, null, false);
    }

    /** Same window as {@code range} over the main timeline, or over {@code branchId} when given. */
    public static ArchiveQuery timeline(String branchId, MessageRange range) {
        Integer limit = range.unbounded() ? null : (int) range.limit();
        return new ArchiveQuery(branchId, branchId == null, null, null,
                range.fromEnd() ? 0 : range.offset(), limit, range.fromEnd());
    }
}
