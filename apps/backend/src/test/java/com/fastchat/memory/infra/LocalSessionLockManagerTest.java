package com.fastchat.memory.infra;

import com.fastchat.memory.service.impl.MemoryKeys;
import com.fastchat.memory.support.MemoryFixtures;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSessionLockManagerTest {

    private final MemoryFixtures.ManualTicker ticker = new MemoryFixtures.ManualTicker();
    private final LocalSessionLockManager locks = new LocalSessionLockManager(new MemoryKeys("t:"),
            Duration.ofSeconds(2), Duration.ofMillis(100), Duration.ofMillis(10), ticker);

    @Test
    void expiredHolderCannotReleaseTheNextOwnersLock() {
        Disposable stale = locks.withLock("S", Mono::never).subscribe();
        assertThat(locks.isLocked("S")).isTrue();

        ticker.advance(Duration.ofSeconds(3));
        assertThat(locks.isLocked("S")).isFalse();

        Disposable current = locks.withLock("S", Mono::never).subscribe();
        assertThat(locks.isLocked("S")).isTrue();

        stale.dispose();
        assertThat(locks.isLocked("S")).isTrue();

        current.dispose();
        assertThat(locks.isLocked("S")).isFalse();
    }

    @Test
    void locksAreIndependentPerSession() {
        Disposable held = locks.withLock("A", Mono::never).subscribe();

        assertThat(locks.withLock("B", () -> Mono.just(1)).block(Duration.ofSeconds(1))).isEqualTo(1);
        assertThat(locks.isLocked("A")).isTrue();
        held.dispose();
    }
}
