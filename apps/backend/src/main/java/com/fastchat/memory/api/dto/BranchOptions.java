package com.fastchat.memory.api.dto;

import java.util.Map;

public record BranchOptions(String name, Map<String, Object> metadata) {

    public static BranchOptions none() {
        return new BranchOptions(null, Map.of());
    }

    public static BranchOptions named(String name) {
        return new BranchOptions(name, Map.of());
    }
}
