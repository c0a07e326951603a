package com.fastchat.memory.api.dto;

import java.time.Duration;

/**
 * @param olderThan  only branches created before {@code now - olderThan} are archived; null uses the configured cutoff
 * @param keepActive never archive the active branch
 * @param limit      number of most relevant branches kept untouched; null uses the configured keep-limit
 */
public record BranchCleanupOptions(Duration olderThan, boolean keepActive, Integer limit) {

    public static BranchCleanupOptions defaults() {
        return new BranchCleanupOptions(null, true, null);
    }
}
