package com.fastchat.memory.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BranchHistoryEntry(
        String sessionId,
        String branchId,
        BranchAction action,
        long timestamp,
        Map<String, Object> details
) {
    public BranchHistoryEntry {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
