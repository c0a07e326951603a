package com.fastchat.memory.infra;

import com.fastchat.memory.service.impl.MemoryKeys;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Process-local lock table. Entries expire after the lock TTL like their Redis counterparts.
 */
public class LocalSessionLockManager extends AbstractSessionLockManager {

    private final MemoryKeys keys;
    private final Cache<String, String> locks;

    public LocalSessionLockManager(MemoryKeys keys, Duration lockTtl, Duration wait, Duration pollInterval, Ticker ticker) {
        super(lockTtl, wait, pollInterval);
        this.keys = keys;
        this.locks = Caffeine.newBuilder()
                .expireAfterWrite(lockTtl)
                .ticker(ticker)
                .build();
    }

    @Override
    protected Mono<Boolean> tryAcquire(String sessionId, String token) {
        return Mono.fromSupplier(() -> locks.asMap().putIfAbsent(keys.lock(sessionId), token) == null);
    }

    @Override
    protected Mono<Void> release(String sessionId, String token) {
        return Mono.fromRunnable(() -> locks.asMap().remove(keys.lock(sessionId), token));
    }

    public boolean isLocked(String sessionId) {
        return locks.getIfPresent(keys.lock(sessionId)) != null;
    }
}
