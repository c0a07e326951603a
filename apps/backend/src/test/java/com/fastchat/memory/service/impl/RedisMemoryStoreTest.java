package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.exception.MemoryErrorCode;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.infra.LocalSessionLockManager;
import com.fastchat.memory.support.MemoryFixtures;
import com.fastchat.memory.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Optional;

import static com.fastchat.memory.support.MemoryFixtures.T0;
import static com.fastchat.memory.support.MemoryFixtures.message;
import static com.fastchat.memory.support.MemoryFixtures.onBranch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisMemoryStoreTest {

    private static final Duration TTL = Duration.ofHours(1);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReactiveStringRedisTemplate redis;
    private ReactiveValueOperations<String, String> values;
    private ReactiveZSetOperations<String, String> zsets;
    private RedisMemoryStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(ReactiveStringRedisTemplate.class);
        values = mock(ReactiveValueOperations.class);
        zsets = mock(ReactiveZSetOperations.class);
        when(redis.opsForValue()).thenReturn(values);
        when(redis.opsForZSet()).thenReturn(zsets);
        when(redis.expire(anyString(), any(Duration.class))).thenReturn(Mono.just(true));

        MemoryKeys keys = new MemoryKeys("p:");
        LocalSessionLockManager locks = new LocalSessionLockManager(keys, Duration.ofSeconds(2),
                Duration.ofMillis(150), Duration.ofMillis(10), new MemoryFixtures.ManualTicker());
        store = new RedisMemoryStore(redis, objectMapper, keys, locks, new MutableClock(T0), TTL);
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    @Test
    void mainAndBranchMessagesGoToTheirOwnIndex() {
        when(values.set(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(true));
        when(values.get(anyString())).thenReturn(Mono.empty());
        when(zsets.add(anyString(), anyString(), anyDouble())).thenReturn(Mono.just(true));

        StepVerifier.create(store.addMessage(message("m1", "S", Role.USER, "hi", T0))).verifyComplete();
        StepVerifier.create(store.addMessage(onBranch(message("m2", "S", Role.USER, "alt", T0 + 1), "b1")))
                .verifyComplete();

        verify(zsets).add("p:messages:S", "m1", (double) T0);
        verify(zsets).add("p:branch:b1:messages", "m2", (double) (T0 + 1));
        verify(zsets, never()).add(eq("p:messages:S"), eq("m2"), anyDouble());
        verify(values).set(eq("p:message:m1"), anyString(), eq(TTL));
        verify(values).set(eq("p:session:S"), anyString(), eq(TTL));
    }

    @Test
    @SuppressWarnings("unchecked")
    void recentWindowUsesNegativeZrangeBoundsAndRestartsBodyTtls() throws Exception {
        when(zsets.range(anyString(), any(Range.class))).thenReturn(Flux.just("m1", "m2"));
        when(values.get("p:message:m1")).thenReturn(Mono.just(json(message("m1", "S", Role.USER, "a", T0))));
        when(values.get("p:message:m2")).thenReturn(Mono.just(json(message("m2", "S", Role.ASSISTANT, "b", T0 + 1))));

        StepVerifier.create(store.getMessages("S", Optional.empty(), MessageRange.last(2)))
                .assertNext(m -> assertThat(m.getId()).isEqualTo("m1"))
                .assertNext(m -> assertThat(m.getId()).isEqualTo("m2"))
                .verifyComplete();

        ArgumentCaptor<Range<Long>> range = ArgumentCaptor.forClass(Range.class);
        verify(zsets).range(eq("p:messages:S"), range.capture());
        assertThat(range.getValue().getLowerBound().getValue()).contains(-2L);
        assertThat(range.getValue().getUpperBound().getValue()).contains(-1L);
        verify(redis).expire("p:message:m1", TTL);
        verify(redis).expire("p:message:m2", TTL);
    }

    @Test
    void unreadableEntryReadsAsMissing() {
        when(values.get("p:message:bad")).thenReturn(Mono.just("{oops"));

        StepVerifier.create(store.getMessage("bad")).verifyComplete();
    }

    @Test
    void gettingASessionRefreshesItsTtl() throws Exception {
        when(values.get("p:session:S")).thenReturn(Mono.just(json(Session.create("S", T0))));

        StepVerifier.create(store.getSession("S"))
                .assertNext(s -> assertThat(s.getId()).isEqualTo("S"))
                .verifyComplete();
        verify(redis).expire("p:session:S", TTL);
    }

    @Test
    void connectionFailureSurfacesAsStoreUnavailable() {
        when(values.get(anyString())).thenReturn(Mono.error(new RedisConnectionFailureException("refused")));

        StepVerifier.create(store.getMessage("m1"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(StoreUnavailableException.class);
                    assertThat(((StoreUnavailableException) e).getCode()).isEqualTo(MemoryErrorCode.STORE_UNAVAILABLE);
                    assertThat(((StoreUnavailableException) e).isRetryable()).isTrue();
                })
                .verify(Duration.ofSeconds(2));
    }
}
