package com.fastchat.memory.infra;

import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Coarse per-session mutual exclusion with a bounded wait and a bounded hold time.
 */
public interface SessionLockManager {

    /**
     * @throws com.fastchat.memory.exception.LockTimeoutException when the lock is not acquired in time
     */
    <T> Mono<T> withLock(String sessionId, Supplier<Mono<T>> work);
}
