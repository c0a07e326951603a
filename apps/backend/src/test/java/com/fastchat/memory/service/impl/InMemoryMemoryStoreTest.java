package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchAction;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.LockTimeoutException;
import com.fastchat.memory.exception.MemoryErrorCode;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.support.MemoryFixtures;
import com.fastchat.memory.support.MemoryFixtures.ManualTicker;
import com.fastchat.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.fastchat.memory.support.MemoryFixtures.T0;
import static com.fastchat.memory.support.MemoryFixtures.message;
import static com.fastchat.memory.support.MemoryFixtures.onBranch;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMemoryStoreTest {

    private MemoryProperties props;
    private MutableClock clock;
    private ManualTicker ticker;
    private InMemoryMemoryStore store;

    @BeforeEach
    void setUp() {
        props = MemoryFixtures.props();
        clock = new MutableClock(T0);
        ticker = new ManualTicker();
        store = MemoryFixtures.inMemoryStore(props, clock, ticker);
    }

    private List<String> ids(String sessionId, Optional<String> branchId, MessageRange range) {
        return store.getMessages(sessionId, branchId, range)
                .map(Message::getId)
                .collectList()
                .block();
    }

    @Test
    void messagesComeBackInTimestampOrderRegardlessOfInsertOrder() {
        store.addMessage(message("m3", "s1", Role.USER, "third", T0 + 30)).block();
        store.addMessage(message("m1", "s1", Role.USER, "first", T0 + 10)).block();
        store.addMessage(message("m2", "s1", Role.ASSISTANT, "second", T0 + 20)).block();

        assertThat(ids("s1", Optional.empty(), MessageRange.all())).containsExactly("m1", "m2", "m3");
    }

    @Test
    void branchMessagesStayOutOfTheMainTimeline() {
        store.addMessage(message("u1", "s1", Role.USER, "hi", T0 + 1)).block();
        store.addMessage(onBranch(message("b1", "s1", Role.ASSISTANT, "alt", T0 + 2), "B")).block();

        assertThat(ids("s1", Optional.empty(), MessageRange.all())).containsExactly("u1");
        assertThat(ids("s1", Optional.of("B"), MessageRange.all())).containsExactly("b1");
        StepVerifier.create(store.countMessages("s1", Optional.of("B"))).expectNext(1L).verifyComplete();
    }

    @Test
    void rangesSelectFromHeadOrTail() {
        for (int i = 1; i <= 5; i++) {
            store.addMessage(message("m" + i, "s1", Role.USER, "c" + i, T0 + i)).block();
        }

        assertThat(ids("s1", Optional.empty(), MessageRange.last(2))).containsExactly("m4", "m5");
        assertThat(ids("s1", Optional.empty(), MessageRange.of(1, 2))).containsExactly("m2", "m3");
        assertThat(ids("s1", Optional.empty(), MessageRange.last(10))).hasSize(5);
        assertThat(ids("s1", Optional.empty(), MessageRange.of(7, 2))).isEmpty();
    }

    @Test
    void firstAppendCreatesTheSessionAndEveryAppendBumpsTheCounter() {
        store.addMessage(message("m1", "s1", Role.USER, "a", T0 + 1)).block();
        store.addMessage(message("m2", "s1", Role.ASSISTANT, "b", T0 + 2)).block();

        Session session = store.getSession("s1").block();
        assertThat(session).isNotNull();
        assertThat(session.getMessageCount()).isEqualTo(2);
        assertThat(session.getModelId()).isEqualTo(Session.DEFAULT_MODEL_ID);
        assertThat(session.getActiveBranchId()).isNull();
    }

    @Test
    void appendFailsWithLockTimeoutWhileAnotherWriterHoldsTheSession() {
        Disposable holder = store.withSessionLock("s1", Mono::never).subscribe();
        try {
            StepVerifier.create(store.addMessage(message("m1", "s1", Role.USER, "x", T0)))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(LockTimeoutException.class);
                        assertThat(((LockTimeoutException) e).isRetryable()).isTrue();
                    })
                    .verify(Duration.ofSeconds(5));
        } finally {
            holder.dispose();
        }

        // cancelling the holder released the lock
        StepVerifier.create(store.addMessage(message("m1", "s1", Role.USER, "x", T0)))
                .verifyComplete();
    }

    @Test
    void lockIsReleasedWhenTheLockedWorkFails() {
        StepVerifier.create(store.withSessionLock("s1", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

        StepVerifier.create(store.addMessage(message("m1", "s1", Role.USER, "x", T0)))
                .verifyComplete();
    }

    @Test
    void entriesExpireAfterTheTtlWithoutAccess() {
        store.addMessage(message("m1", "s1", Role.USER, "x", T0)).block();

        ticker.advance(props.getRedis().getSessionTtl().minusMinutes(1));
        assertThat(store.getSession("s1").block()).isNotNull();

        // the read above refreshed the session but not the message
        ticker.advance(Duration.ofMinutes(2));
        assertThat(store.getSession("s1").block()).isNotNull();
        assertThat(store.getMessage("m1").block()).isNull();
    }

    @Test
    void deleteMessageRemovesBodyAndIndexEntry() {
        store.addMessage(message("m1", "s1", Role.USER, "a", T0 + 1)).block();
        store.addMessage(message("m2", "s1", Role.USER, "b", T0 + 2)).block();

        store.deleteMessage("m1").block();

        assertThat(store.getMessage("m1").block()).isNull();
        assertThat(ids("s1", Optional.empty(), MessageRange.all())).containsExactly("m2");
    }

    @Test
    void deleteSessionCascadesToBranchesAndMessages() {
        store.addMessage(message("m1", "s1", Role.USER, "a", T0 + 1)).block();
        store.addMessage(onBranch(message("b1", "s1", Role.USER, "b", T0 + 2), "B")).block();
        store.saveBranch(Branch.builder().id("B").sessionId("s1").originMessageId("m1").build()).block();
        store.updateSession("s1", s -> s.withBranch("B")).block();
        store.appendBranchHistory(new BranchHistoryEntry("s1", "B", BranchAction.CREATE, T0, Map.of())).block();

        store.deleteSession("s1").block();

        assertThat(store.getSession("s1").block()).isNull();
        assertThat(store.getBranch("B").block()).isNull();
        assertThat(store.getMessage("m1").block()).isNull();
        assertThat(store.getMessage("b1").block()).isNull();
        assertThat(store.getBranchHistory("s1").collectList().block()).isEmpty();
    }

    @Test
    void updateSessionIsEmptyForUnknownSession() {
        StepVerifier.create(store.updateSession("missing", s -> s.touched(1L))).verifyComplete();
    }

    @Test
    void versionListsAndHistoryKeepInsertionOrder() {
        store.addMessageVersion("root", "root").block();
        store.addMessageVersion("root", "v2").block();
        store.addMessageVersion("root", "v3").block();
        store.appendBranchHistory(new BranchHistoryEntry("s1", "A", BranchAction.CREATE, T0, Map.of())).block();
        store.appendBranchHistory(new BranchHistoryEntry("s1", "A", BranchAction.SWITCH, T0 + 1, Map.of())).block();

        assertThat(store.getMessageVersionIds("root").collectList().block()).containsExactly("root", "v2", "v3");
        assertThat(store.getBranchHistory("s1").map(BranchHistoryEntry::action).collectList().block())
                .containsExactly(BranchAction.CREATE, BranchAction.SWITCH);
    }

    @Test
    void closedStoreReportsNotInitialized() {
        store.close();

        StepVerifier.create(store.getSession("s1"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(StoreUnavailableException.class)
                        .extracting(x -> ((StoreUnavailableException) x).getCode())
                        .isEqualTo(MemoryErrorCode.NOT_INITIALIZED))
                .verify();
        StepVerifier.create(store.addMessage(message("m1", "s1", Role.USER, "x", T0)))
                .expectError(StoreUnavailableException.class)
                .verify();
    }
}
