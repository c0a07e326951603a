package com.fastchat.memory.infra;

import com.fastchat.memory.exception.LockTimeoutException;
import com.fastchat.memory.service.impl.MemoryKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisSessionLockManagerTest {

    private ReactiveStringRedisTemplate redis;
    private ReactiveValueOperations<String, String> values;
    private RedisSessionLockManager locks;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(ReactiveStringRedisTemplate.class);
        values = mock(ReactiveValueOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        when(redis.execute(any(RedisScript.class), anyList(), anyList())).thenReturn(Flux.just(1L));
        locks = new RedisSessionLockManager(redis, new MemoryKeys("p:"),
                Duration.ofSeconds(2), Duration.ofMillis(100), Duration.ofMillis(10));
    }

    @Test
    @SuppressWarnings("unchecked")
    void runsWorkAndReleasesWithItsOwnToken() {
        when(values.setIfAbsent(eq("p:lock:session:S"), anyString(), eq(Duration.ofSeconds(2))))
                .thenReturn(Mono.just(true));

        StepVerifier.create(locks.withLock("S", () -> Mono.just("done")))
                .expectNext("done")
                .verifyComplete();

        verify(redis).execute(any(RedisScript.class), eq(List.of("p:lock:session:S")), anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void contendedLockTimesOutWithoutRunningWork() {
        when(values.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(false));
        AtomicBoolean ran = new AtomicBoolean();

        StepVerifier.create(locks.withLock("S", () -> Mono.fromRunnable(() -> ran.set(true))))
                .expectError(LockTimeoutException.class)
                .verify(Duration.ofSeconds(2));

        assertThat(ran).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void attemptCutOffByTheWaitBudgetIsClearedByToken() {
        when(values.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.never());

        StepVerifier.create(locks.withLock("S", () -> Mono.just("unreached")))
                .expectError(LockTimeoutException.class)
                .verify(Duration.ofSeconds(2));

        verify(redis).execute(any(RedisScript.class), eq(List.of("p:lock:session:S")), anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void lockIsReleasedWhenWorkFails() {
        when(values.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(true));

        StepVerifier.create(locks.withLock("S", () -> Mono.error(new IllegalStateException("boom"))))
                .expectErrorMessage("boom")
                .verify(Duration.ofSeconds(2));

        verify(redis).execute(any(RedisScript.class), anyList(), anyList());
    }
}
