package com.fastchat.memory.infra;

import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.MemoryException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Capped, jittered exponential backoff for transient memory failures (lock contention,
 * store outages). Deterministic failures pass straight through. When attempts run out the
 * last underlying error is rethrown as is.
 */
@Slf4j
public class RetrySupport {

    private static final double JITTER = 0.5;

    private final MemoryProperties.Retry cfg;

    public RetrySupport(MemoryProperties.Retry cfg) {
        this.cfg = cfg;
    }

    public <T> Mono<T> withRetry(String operation, Mono<T> source) {
        return source.retryWhen(spec(operation));
    }

    /**
     * Sequences are buffered and retried as a whole, so a failure after some elements were read
     * never hands the same element downstream twice.
     */
    public <T> Flux<T> withRetry(String operation, Flux<T> source) {
        return source.collectList()
                .retryWhen(spec(operation))
                .flatMapIterable(items -> items);
    }

    RetryBackoffSpec spec(String operation) {
        long retries = Math.max(0, cfg.getMaxAttempts() - 1L);
        return Retry.backoff(retries, cfg.getBaseDelay())
                .maxBackoff(cfg.getMaxDelay())
                .jitter(JITTER)
                .filter(MemoryException::isRetryable)
                .doBeforeRetry(signal -> log.warn("[Retry] {} attempt={} err={}",
                        operation, signal.totalRetries() + 2, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
