package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.ArchiveQuery;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.infra.RetrySupport;
import com.fastchat.memory.service.impl.InMemoryMemoryStore;
import com.fastchat.memory.support.MemoryFixtures;
import com.fastchat.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Optional;

import static com.fastchat.memory.support.MemoryFixtures.T0;
import static com.fastchat.memory.support.MemoryFixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryManagerTest {

    @Mock
    private ArchivalSink archive;
    @Mock
    private ContextAssembler contextAssembler;
    @Mock
    private BranchManager branchManager;

    private InMemoryMemoryStore store;
    private MemoryManager memory;

    @BeforeEach
    void setUp() {
        MemoryProperties props = MemoryFixtures.props();
        MutableClock clock = new MutableClock(T0);
        store = MemoryFixtures.inMemoryStore(props, clock, new MemoryFixtures.ManualTicker());
        memory = new MemoryManager(store, contextAssembler, branchManager, archive,
                new RetrySupport(props.getRetry()), clock);
    }

    @Test
    void forgottenMainTimelineIsReadFromTheArchiveNewestWindowFirst() {
        when(archive.isEnabled()).thenReturn(true);
        when(archive.queryMessages(eq("S"), any())).thenReturn(Flux.just(
                message("m2", "S", Role.USER, "older", T0 + 2),
                message("m3", "S", Role.ASSISTANT, "newer", T0 + 3)));

        StepVerifier.create(memory.getMessages("S", Optional.empty(), MessageRange.last(2)))
                .assertNext(m -> assertThat(m.getId()).isEqualTo("m2"))
                .assertNext(m -> assertThat(m.getId()).isEqualTo("m3"))
                .verifyComplete();

        ArgumentCaptor<ArchiveQuery> query = ArgumentCaptor.forClass(ArchiveQuery.class);
        verify(archive).queryMessages(eq("S"), query.capture());
        assertThat(query.getValue().mainOnly()).isTrue();
        assertThat(query.getValue().branchId()).isNull();
        assertThat(query.getValue().newestFirst()).isTrue();
        assertThat(query.getValue().limit()).isEqualTo(2);
    }

    @Test
    void branchFallbackTargetsThatBranchOnly() {
        when(archive.isEnabled()).thenReturn(true);
        when(archive.queryMessages(eq("S"), any())).thenReturn(Flux.empty());

        StepVerifier.create(memory.getMessages("S", Optional.of("b1"), MessageRange.all())).verifyComplete();

        ArgumentCaptor<ArchiveQuery> query = ArgumentCaptor.forClass(ArchiveQuery.class);
        verify(archive).queryMessages(eq("S"), query.capture());
        assertThat(query.getValue().branchId()).isEqualTo("b1");
        assertThat(query.getValue().mainOnly()).isFalse();
        assertThat(query.getValue().limit()).isNull();
    }

    @Test
    void liveTimelineNeverTouchesTheArchive() {
        when(archive.isEnabled()).thenReturn(true);
        when(archive.upsertMessage(any())).thenReturn(Mono.empty());
        memory.storeMessage(message("m1", "S", Role.USER, "hi", T0)).block();

        StepVerifier.create(memory.getMessages("S", Optional.empty(), MessageRange.last(5)))
                .assertNext(m -> assertThat(m.getId()).isEqualTo("m1"))
                .verifyComplete();

        verify(archive).upsertMessage(any(Message.class));
        verify(archive, never()).queryMessages(any(), any());
    }

    @Test
    void readThatFailsPartwayIsRetriedWithoutDuplicates() {
        store.addMessage(message("m1", "S", Role.USER, "a", T0)).block();
        store.addMessage(message("m2", "S", Role.ASSISTANT, "b", T0 + 1)).block();
        InMemoryMemoryStore flaky = spy(store);
        int[] calls = {0};
        doAnswer(inv -> {
            Flux<Message> real = store.getMessages("S", Optional.empty(), inv.getArgument(2));
            return Flux.defer(() -> calls[0]++ == 0
                    ? real.take(1).concatWith(Flux.error(new StoreUnavailableException("blip", null)))
                    : real);
        }).when(flaky).getMessages(eq("S"), eq(Optional.empty()), any(MessageRange.class));
        MemoryManager retrying = new MemoryManager(flaky, contextAssembler, branchManager, archive,
                new RetrySupport(MemoryFixtures.props().getRetry()), new MutableClock(T0));

        StepVerifier.create(retrying.getMessages("S", Optional.empty(), MessageRange.all()).map(Message::getId))
                .expectNext("m1", "m2")
                .verifyComplete();
    }
}
