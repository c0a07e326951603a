package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.ArchiveQuery;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.mapper.ArchivedMessageMapper;
import com.fastchat.memory.service.ArchivalSink;
import com.fastchat.memory.service.impl.entity.ArchivedMessageEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * MyBatis-backed archive (table {@code archived_messages}). Mapper calls block, so they run on boundedElastic.
 */
@Slf4j
public class DatabaseArchivalSink implements ArchivalSink {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ArchivedMessageMapper mapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int queryLimit;

    public DatabaseArchivalSink(ArchivedMessageMapper mapper, ObjectMapper objectMapper, Clock clock, int queryLimit) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.queryLimit = queryLimit;
    }

    @Override
    public Mono<Void> upsertMessage(Message message) {
        return Mono.fromCallable(() -> mapper.upsertMessage(toEntity(message)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(n -> log.debug("[Archive] upsert messageId={} sessionId={} rows={}",
                        message.getId(), message.getSessionId(), n))
                .then();
    }

    @Override
    public Flux<Message> queryMessages(String sessionId, ArchiveQuery query) {
        ArchiveQuery q = query == null ? ArchiveQuery.all() : query;
        int limit = q.limit() != null && q.limit() > 0 ? Math.min(q.limit(), queryLimit) : queryLimit;
        String role = q.role() == null ? null : q.role().wireName();
        return Mono.fromCallable(() -> mapper.selectMessages(sessionId, q.branchId(), q.mainOnly(), role, q.since(),
                        q.newestFirst(), q.offset(), limit))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(rows -> log.debug("[Archive] query sessionId={} branchId={} -> {} row(s)",
                        sessionId, q.branchId(), rows.size()))
                .flatMapIterable(rows -> {
                    if (!q.newestFirst()) {
                        return rows;
                    }
                    List<ArchivedMessageEntity> chronological = new ArrayList<>(rows);
                    Collections.reverse(chronological);
                    return chronological;
                })
                .map(this::toMessage);
    }

    @Override
    public Mono<Void> deleteSession(String sessionId) {
        return Mono.fromCallable(() -> mapper.deleteBySession(sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(n -> log.debug("[Archive] deleted sessionId={} rows={}", sessionId, n))
                .then();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    ArchivedMessageEntity toEntity(Message message) {
        ArchivedMessageEntity e = new ArchivedMessageEntity();
        e.setId(message.getId());
        e.setSessionId(message.getSessionId());
        e.setBranchId(message.getBranchId());
        e.setParentMessageId(message.getParentMessageId());
        e.setRole(message.getRole() == null ? Role.USER.wireName() : message.getRole().wireName());
        e.setContent(message.getContent() == null ? "" : message.getContent());
        e.setMessageTimestamp(message.getTimestamp());
        e.setVersion(message.getVersion());
        e.setMetadata(writeMetadata(message.getMetadata()));
        e.setArchivedAt(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return e;
    }

    Message toMessage(ArchivedMessageEntity e) {
        return Message.builder()
                .id(e.getId())
                .sessionId(e.getSessionId())
                .branchId(e.getBranchId())
                .parentMessageId(e.getParentMessageId())
                .role(Role.fromWire(e.getRole()))
                .content(e.getContent())
                .timestamp(e.getMessageTimestamp() == null ? 0L : e.getMessageTimestamp())
                .version(e.getVersion() == null ? 1 : e.getVersion())
                .metadata(readMetadata(e.getMetadata()))
                .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            log.warn("[Archive] metadata not serializable, dropped: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("[Archive] unreadable metadata ignored: {}", ex.getOriginalMessage());
            return Map.of();
        }
    }
}
