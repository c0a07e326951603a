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
 * One stored chat message. Instances are never mutated once written; edits and merges
 * produce new messages (see {@link #toBuilder()}).
 *
 * <p>{@code branchId == null} means the message sits on the main timeline.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    public static final String META_TOKENS = "tokens";
    public static final String META_EDITED = "edited";
    public static final String META_ORIGINAL_MESSAGE_ID = "originalMessageId";
    public static final String META_ORIGINAL_CONTENT = "originalContent";
    public static final String META_ROOT_MESSAGE_ID = "rootMessageId";
    public static final String META_MERGED_FROM = "mergedFrom";
    public static final String META_PERSISTED_AT = "persistedAt";
    public static final String META_MODEL = "model";

    String id;
    String sessionId;
    Role role;
    String content;
    /** Logical ordering key (epoch millis). */
    long timestamp;
    String branchId;
    String parentMessageId;
    @Builder.Default
    int version = 1;
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @JsonIgnore
    public Optional<String> branch() {
        return Optional.ofNullable(branchId);
    }

    @JsonIgnore
    public boolean isOnMainTimeline() {
        return branchId == null;
    }

    @JsonIgnore
    public Object metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }

    /** Stored token estimate, if the producer recorded one. */
    @JsonIgnore
    public Optional<Integer> storedTokenEstimate() {
        Object raw = metadataValue(META_TOKENS);
        if (raw instanceof Number n && n.intValue() > 0) {
            return Optional.of(n.intValue());
        }
        return Optional.empty();
    }

    /** Id of the first message in this message's edit chain. */
    @JsonIgnore
    public String rootMessageId() {
        Object root = metadataValue(META_ROOT_MESSAGE_ID);
        return root instanceof String s && !s.isBlank() ? s : id;
    }

    public Message withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        merged.putAll(extra);
        return toBuilder().metadata(Collections.unmodifiableMap(merged)).build();
    }
}
