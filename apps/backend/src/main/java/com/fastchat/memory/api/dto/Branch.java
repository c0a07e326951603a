package com.fastchat.memory.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A named alternate continuation forked from {@link #originMessageId}.
 * The main timeline has no record of its own; a {@code null} parent means the fork came from main.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Branch {
    String id;
    String name;
    String sessionId;
    String parentBranchId;
    String originMessageId;
    long createdAt;
    int depth;
    boolean active;
    boolean archived;
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @JsonIgnore
    public Optional<String> parentBranch() {
        return Optional.ofNullable(parentBranchId);
    }

    public Branch withActive(boolean value) {
        return toBuilder().active(value).build();
    }

    public Branch withArchived(boolean value) {
        return toBuilder().archived(value).build();
    }

    public Branch withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        merged.put(key, value);
        return toBuilder().metadata(Collections.unmodifiableMap(merged)).build();
    }
}
