package com.fastchat.memory.infra;

import com.fastchat.memory.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Polls {@link #tryAcquire} until it succeeds or the wait budget runs out,
 * and always releases through {@link Mono#usingWhen}.
 */
@Slf4j
public abstract class AbstractSessionLockManager implements SessionLockManager {

    protected final Duration lockTtl;
    private final Duration wait;
    private final Duration pollInterval;

    protected AbstractSessionLockManager(Duration lockTtl, Duration wait, Duration pollInterval) {
        this.lockTtl = lockTtl;
        this.wait = wait;
        this.pollInterval = pollInterval;
    }

    /** Sets the lock if absent. Emits true when this token now owns it. */
    protected abstract Mono<Boolean> tryAcquire(String sessionId, String token);

    /** Deletes the lock only when it is still owned by {@code token}. */
    protected abstract Mono<Void> release(String sessionId, String token);

    @Override
    public <T> Mono<T> withLock(String sessionId, Supplier<Mono<T>> work) {
        return Mono.usingWhen(
                acquire(sessionId),
                token -> work.get(),
                token -> safeRelease(sessionId, token));
    }

    private Mono<String> acquire(String sessionId) {
        String token = UUID.randomUUID().toString();
        return Mono.defer(() -> tryAcquire(sessionId, token))
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval))
                .timeout(wait, Mono.error(() -> new LockTimeoutException(sessionId, wait)))
                // an abandoned attempt may still have set the key; clear it by token
                .onErrorResume(LockTimeoutException.class, e -> safeRelease(sessionId, token).then(Mono.error(e)))
                .doOnCancel(() -> safeRelease(sessionId, token).subscribe())
                .doOnNext(ok -> log.trace("[Lock] acquired sessionId={} token={}", sessionId, token))
                .thenReturn(token);
    }

    private Mono<Void> safeRelease(String sessionId, String token) {
        return release(sessionId, token)
                .doOnSuccess(v -> log.trace("[Lock] released sessionId={} token={}", sessionId, token))
                .onErrorResume(e -> {
                    // the lock TTL still bounds how long it can linger
                    log.warn("[Lock] release failed sessionId={} err={}", sessionId, e.toString());
                    return Mono.empty();
                });
    }
}
