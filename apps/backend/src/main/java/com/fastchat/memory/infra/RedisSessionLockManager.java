package com.fastchat.memory.infra;

import com.fastchat.memory.service.impl.MemoryKeys;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * SET NX PX lock; release compares the owner token so an expired-and-retaken lock is never deleted by the old holder.
 */
public class RedisSessionLockManager extends AbstractSessionLockManager {

    private static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final ReactiveStringRedisTemplate redis;
    private final MemoryKeys keys;

    public RedisSessionLockManager(ReactiveStringRedisTemplate redis, MemoryKeys keys,
                                   Duration lockTtl, Duration wait, Duration pollInterval) {
        super(lockTtl, wait, pollInterval);
        this.redis = redis;
        this.keys = keys;
    }

    @Override
    protected Mono<Boolean> tryAcquire(String sessionId, String token) {
        return redis.opsForValue()
                .setIfAbsent(keys.lock(sessionId), token, lockTtl)
                .defaultIfEmpty(false);
    }

    @Override
    protected Mono<Void> release(String sessionId, String token) {
        return redis.execute(RELEASE_SCRIPT, List.of(keys.lock(sessionId)), List.of(token)).then();
    }
}
