package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.infra.SessionLockManager;
import com.fastchat.memory.service.MemoryStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Redis layout: JSON strings for sessions, messages and branches, sorted sets scored by timestamp
 * for the timeline indices, lists for version chains and branch history.
 */
@Slf4j
public class RedisMemoryStore implements MemoryStore {

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final MemoryKeys keys;
    private final SessionLockManager locks;
    private final Clock clock;
    private final Duration ttl;

    public RedisMemoryStore(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper, MemoryKeys keys,
                            SessionLockManager locks, Clock clock, Duration ttl) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keys = keys;
        this.locks = locks;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Mono<Void> setSession(Session session) {
        return guard(redis.opsForValue().set(keys.session(session.getId()), write(session), ttl)).then();
    }

    @Override
    public Mono<Session> getSession(String sessionId) {
        String key = keys.session(sessionId);
        return guard(getAndTouch(key)).flatMap(json -> read(json, Session.class, key));
    }

    @Override
    public Mono<Session> updateSession(String sessionId, UnaryOperator<Session> mutation) {
        return withSessionLock(sessionId, () -> getSession(sessionId)
                .map(mutation)
                .flatMap(next -> setSession(next).thenReturn(next)));
    }

    @Override
    public Mono<Void> deleteSession(String sessionId) {
        Mono<List<String>> branchIds = getSession(sessionId)
                .map(Session::getBranches)
                .defaultIfEmpty(List.of());
        return guard(branchIds.flatMap(ids -> {
            List<String> indexKeys = new ArrayList<>();
            indexKeys.add(keys.messages(sessionId));
            ids.forEach(id -> indexKeys.add(keys.branchMessages(id)));
            return Flux.fromIterable(indexKeys)
                    .concatMap(indexKey -> redis.opsForZSet().range(indexKey, Range.closed(0L, -1L)))
                    .collectList()
                    .flatMap(messageIds -> {
                        List<String> doomed = new ArrayList<>(indexKeys);
                        doomed.add(keys.session(sessionId));
                        doomed.add(keys.branchHistory(sessionId));
                        doomed.add(keys.lock(sessionId));
                        ids.forEach(id -> doomed.add(keys.branch(id)));
                        for (String messageId : messageIds) {
                            doomed.add(keys.message(messageId));
                            doomed.add(keys.messageVersions(messageId));
                        }
                        return redis.delete(doomed.toArray(String[]::new))
                                .doOnNext(n -> log.debug("[Store] session deleted sessionId={} keys={}", sessionId, n));
                    });
        })).then();
    }

    @Override
    public Mono<Void> addMessage(Message message) {
        Objects.requireNonNull(message.getId(), "message.id");
        Objects.requireNonNull(message.getSessionId(), "message.sessionId");
        String sessionId = message.getSessionId();
        String indexKey = keys.index(sessionId, message.branch());
        return withSessionLock(sessionId, () -> guard(
                redis.opsForValue().set(keys.message(message.getId()), write(message), ttl)
                        .then(redis.opsForZSet().add(indexKey, message.getId(), message.getTimestamp()))
                        .then(redis.expire(indexKey, ttl))
                        .then(bumpSession(sessionId)))
                .doOnSuccess(v -> log.debug("[Store] message added sessionId={} messageId={} branchId={}",
                        sessionId, message.getId(), message.getBranchId())));
    }

    private Mono<Void> bumpSession(String sessionId) {
        return Mono.defer(() -> {
            long now = clock.millis();
            return getSession(sessionId)
                    .defaultIfEmpty(Session.create(sessionId, now))
                    .flatMap(s -> setSession(s.withAppendedMessage(now)));
        });
    }

    @Override
    public Mono<Message> getMessage(String messageId) {
        String key = keys.message(messageId);
        return guard(getAndTouch(key)).flatMap(json -> read(json, Message.class, key));
    }

    @Override
    public Mono<Void> deleteMessage(String messageId) {
        return getMessage(messageId)
                .flatMap(m -> guard(redis.delete(keys.message(messageId))
                        .then(redis.opsForZSet().remove(keys.index(m.getSessionId(), m.branch()), messageId))))
                .then();
    }

    @Override
    public Flux<Message> getMessages(String sessionId, Optional<String> branchId, MessageRange range) {
        long[] bounds = range.toIndexBounds();
        return guard(redis.opsForZSet().range(keys.index(sessionId, branchId), Range.closed(bounds[0], bounds[1]))
                .flatMapSequential(id -> getAndTouch(keys.message(id))))
                .concatMap(json -> read(json, Message.class, "message"));
    }

    @Override
    public Mono<Long> countMessages(String sessionId, Optional<String> branchId) {
        return guard(redis.opsForZSet().size(keys.index(sessionId, branchId))).defaultIfEmpty(0L);
    }

    @Override
    public Mono<Void> saveBranch(Branch branch) {
        return guard(redis.opsForValue().set(keys.branch(branch.getId()), write(branch), ttl)).then();
    }

    @Override
    public Mono<Branch> getBranch(String branchId) {
        String key = keys.branch(branchId);
        return guard(getAndTouch(key)).flatMap(json -> read(json, Branch.class, key));
    }

    @Override
    public Mono<Void> deleteBranch(String branchId) {
        return guard(redis.delete(keys.branch(branchId), keys.branchMessages(branchId))).then();
    }

    @Override
    public Mono<Void> addMessageVersion(String rootMessageId, String versionMessageId) {
        String key = keys.messageVersions(rootMessageId);
        return guard(redis.opsForList().rightPush(key, versionMessageId).then(redis.expire(key, ttl))).then();
    }

    @Override
    public Flux<String> getMessageVersionIds(String rootMessageId) {
        String key = keys.messageVersions(rootMessageId);
        return guard(redis.expire(key, ttl).thenMany(redis.opsForList().range(key, 0, -1)));
    }

    @Override
    public Mono<Void> appendBranchHistory(BranchHistoryEntry entry) {
        String key = keys.branchHistory(entry.sessionId());
        return guard(redis.opsForList().rightPush(key, write(entry)).then(redis.expire(key, ttl))).then();
    }

    @Override
    public Flux<BranchHistoryEntry> getBranchHistory(String sessionId) {
        String key = keys.branchHistory(sessionId);
        return guard(redis.expire(key, ttl).thenMany(redis.opsForList().range(key, 0, -1)))
                .concatMap(json -> read(json, BranchHistoryEntry.class, key));
    }

    @Override
    public <T> Mono<T> withSessionLock(String sessionId, Supplier<Mono<T>> work) {
        return guard(locks.withLock(sessionId, work));
    }

    /** Reads a value and restarts its TTL, matching the access-based expiry of the in-memory store. */
    private Mono<String> getAndTouch(String key) {
        return redis.opsForValue().get(key).flatMap(json -> redis.expire(key, ttl).thenReturn(json));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> Mono<T> read(String json, Class<T> type, String key) {
        if (json == null || json.isEmpty()) {
            return Mono.empty();
        }
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("[Store] unreadable entry key={} type={}", key, type.getSimpleName(), e);
            return Mono.empty();
        }
    }

    private <T> Mono<T> guard(Mono<T> op) {
        return op.onErrorMap(DataAccessException.class, e -> new StoreUnavailableException("Redis unavailable", e));
    }

    private <T> Flux<T> guard(Flux<T> op) {
        return op.onErrorMap(DataAccessException.class, e -> new StoreUnavailableException("Redis unavailable", e));
    }
}
