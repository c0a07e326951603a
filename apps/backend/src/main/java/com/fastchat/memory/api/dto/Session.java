package com.fastchat.memory.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {

    public static final String DEFAULT_MODEL_ID = "default";

    String id;
    long createdAt;
    long lastAccessedAt;
    long messageCount;
    @Builder.Default
    List<String> branches = List.of();
    /** Null while the main timeline is active. */
    String activeBranchId;
    @Builder.Default
    String modelId = DEFAULT_MODEL_ID;
    ModelConfig modelConfig;

    public static Session create(String id, long now) {
        return Session.builder()
                .id(id)
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
    }

    @JsonIgnore
    public Optional<String> activeBranch() {
        return Optional.ofNullable(activeBranchId);
    }

    public Session withBranch(String branchId) {
        List<String> ids = new ArrayList<>(branches == null ? List.of() : branches);
        if (!ids.contains(branchId)) {
            ids.add(branchId);
        }
        return toBuilder().branches(List.copyOf(ids)).build();
    }

    public Session withoutBranch(String branchId) {
        List<String> ids = new ArrayList<>(branches == null ? List.of() : branches);
        ids.remove(branchId);
        Session.SessionBuilder builder = toBuilder().branches(List.copyOf(ids));
        if (branchId.equals(activeBranchId)) {
            builder.activeBranchId(null);
        }
        return builder.build();
    }

    public Session touched(long now) {
        return toBuilder().lastAccessedAt(now).build();
    }

    public Session withAppendedMessage(long now) {
        return toBuilder().messageCount(messageCount + 1).lastAccessedAt(now).build();
    }
}
