package com.fastchat.memory.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Resolved storage topology. Each variant only carries what it needs, so
 * combinations such as "archive settings without an archive" cannot be expressed.
 */
public sealed interface MemoryBackend
        permits MemoryBackend.InMemory, MemoryBackend.RedisOnly,
        MemoryBackend.RedisWithArchive, MemoryBackend.RedisWithVector {

    Duration entityTtl();

    String keyPrefix();

    default boolean usesRedis() {
        return !(this instanceof InMemory);
    }

    record InMemory(String keyPrefix, Duration entityTtl) implements MemoryBackend { }

    record RedisOnly(String keyPrefix, Duration entityTtl) implements MemoryBackend { }

    record RedisWithArchive(String keyPrefix, Duration entityTtl, int archiveQueryLimit) implements MemoryBackend { }

    record RedisWithVector(String keyPrefix, Duration entityTtl, double threshold, int limit) implements MemoryBackend { }

    static MemoryBackend from(MemoryProperties props) {
        String prefix = props.getRedis().getPrefix();
        Duration ttl = props.getRedis().getSessionTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalStateException("fastchat.memory.redis.session-ttl must be positive");
        }
        String kind = props.getBackend() == null ? "in-memory" : props.getBackend().trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "in-memory", "memory" -> new InMemory(prefix, ttl);
            case "redis" -> new RedisOnly(prefix, ttl);
            case "redis-archive" -> new RedisWithArchive(prefix, ttl, props.getArchive().getQueryLimit());
            case "redis-vector" -> new RedisWithVector(prefix, ttl,
                    props.getVector().getThreshold(), props.getVector().getLimit());
            default -> throw new IllegalStateException("Unknown fastchat.memory.backend: " + props.getBackend());
        };
    }
}
