package com.fastchat.memory.config;

import com.fastchat.memory.infra.LocalSessionLockManager;
import com.fastchat.memory.infra.RedisSessionLockManager;
import com.fastchat.memory.infra.RetrySupport;
import com.fastchat.memory.infra.SessionLockManager;
import com.fastchat.memory.mapper.ArchivedMessageMapper;
import com.fastchat.memory.service.ArchivalSink;
import com.fastchat.memory.service.MemoryStore;
import com.fastchat.memory.service.SimilarMessageSearch;
import com.fastchat.memory.service.impl.DatabaseArchivalSink;
import com.fastchat.memory.service.impl.InMemoryMemoryStore;
import com.fastchat.memory.service.impl.MemoryKeys;
import com.fastchat.memory.service.impl.NoopArchivalSink;
import com.fastchat.memory.service.impl.RedisMemoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

/**
 * Wires the storage topology picked by {@code fastchat.memory.backend}.
 * Collaborators a variant needs but cannot find fail startup instead of degrading silently.
 */
@Slf4j
@Configuration
public class MemoryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock memoryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public MemoryBackend memoryBackend(MemoryProperties props) {
        MemoryBackend backend = MemoryBackend.from(props);
        log.info("[Store] memory backend resolved: {}", backend);
        return backend;
    }

    @Bean
    public MemoryKeys memoryKeys(MemoryBackend backend) {
        return new MemoryKeys(backend.keyPrefix());
    }

    @Bean
    public SessionLockManager sessionLockManager(MemoryBackend backend,
                                                 MemoryProperties props,
                                                 MemoryKeys keys,
                                                 ObjectProvider<ReactiveStringRedisTemplate> redis) {
        MemoryProperties.Lock lock = props.getLock();
        if (backend.usesRedis()) {
            return new RedisSessionLockManager(requireRedis(redis, backend), keys,
                    lock.getTtl(), lock.getWait(), lock.getPollInterval());
        }
        return new LocalSessionLockManager(keys, lock.getTtl(), lock.getWait(), lock.getPollInterval(),
                Ticker.systemTicker());
    }

    @Bean
    public MemoryStore memoryStore(MemoryBackend backend,
                                   MemoryKeys keys,
                                   SessionLockManager locks,
                                   Clock clock,
                                   ObjectMapper objectMapper,
                                   ObjectProvider<ReactiveStringRedisTemplate> redis,
                                   ObjectProvider<SimilarMessageSearch> similarSearch) {
        if (backend instanceof MemoryBackend.RedisWithVector && similarSearch.getIfAvailable() == null) {
            throw new IllegalStateException(
                    "fastchat.memory.backend=redis-vector requires a SimilarMessageSearch bean");
        }
        if (backend.usesRedis()) {
            return new RedisMemoryStore(requireRedis(redis, backend), objectMapper, keys, locks, clock,
                    backend.entityTtl());
        }
        return new InMemoryMemoryStore(keys, locks, clock, backend.entityTtl(), Ticker.systemTicker());
    }

    @Bean
    public ArchivalSink archivalSink(MemoryBackend backend,
                                     ObjectProvider<ArchivedMessageMapper> mapper,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        if (backend instanceof MemoryBackend.RedisWithArchive archive) {
            ArchivedMessageMapper m = mapper.getIfAvailable();
            if (m == null) {
                throw new IllegalStateException(
                        "fastchat.memory.backend=redis-archive requires a datasource and ArchivedMessageMapper");
            }
            return new DatabaseArchivalSink(m, objectMapper, clock, archive.archiveQueryLimit());
        }
        return new NoopArchivalSink();
    }

    @Bean
    public RetrySupport retrySupport(MemoryProperties props) {
        return new RetrySupport(props.getRetry());
    }

    private static ReactiveStringRedisTemplate requireRedis(ObjectProvider<ReactiveStringRedisTemplate> redis,
                                                            MemoryBackend backend) {
        ReactiveStringRedisTemplate template = redis.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("Backend " + backend + " requires a reactive Redis connection");
        }
        return template;
    }
}
