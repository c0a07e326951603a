package com.fastchat.memory.config;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchOptions;
import com.fastchat.memory.api.dto.ContextOptions;
import com.fastchat.memory.api.dto.MemoryContext;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.service.ArchivalSink;
import com.fastchat.memory.service.MemoryManager;
import com.fastchat.memory.service.MemoryStore;
import com.fastchat.memory.service.impl.InMemoryMemoryStore;
import com.fastchat.memory.service.impl.MemoryKeys;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class MemoryConfigTest {

    @Autowired
    private MemoryProperties props;
    @Autowired
    private MemoryBackend backend;
    @Autowired
    private MemoryKeys keys;
    @Autowired
    private MemoryStore store;
    @Autowired
    private ArchivalSink archivalSink;
    @Autowired
    private MemoryManager memory;

    @Test
    void propertiesBindFromConfiguration() {
        assertThat(props.getLock().getWait()).isEqualTo(Duration.ofMillis(500));
        assertThat(props.getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(props.getBranch().getMergePolicy()).isEqualTo(MemoryProperties.MergePolicy.ARCHIVE_SOURCE);
        assertThat(keys.session("S")).isEqualTo("test:memory:session:S");
    }

    @Test
    void inMemoryBackendWiresLocalCollaborators() {
        assertThat(backend).isInstanceOf(MemoryBackend.InMemory.class);
        assertThat(store).isInstanceOf(InMemoryMemoryStore.class);
        assertThat(archivalSink.isEnabled()).isFalse();
    }

    @Test
    void conversationRoundTripThroughTheManager() {
        String sessionId = UUID.randomUUID().toString();
        memory.createSession(sessionId, "model-a", null).block();
        long now = System.currentTimeMillis();
        memory.storeMessage(message("sys-" + sessionId, sessionId, Role.SYSTEM, "You are terse.", now)).block();
        memory.storeMessage(message("u-" + sessionId, sessionId, Role.USER, "Hello", now + 1)).block();

        Branch branch = memory.createBranch(sessionId, "u-" + sessionId, BranchOptions.named("retry")).block();
        memory.switchBranch(sessionId, branch.getId()).block();
        memory.storeMessage(message("b-" + sessionId, sessionId, Role.USER, "Hello again", now + 2)
                .toBuilder().branchId(branch.getId()).build()).block();

        MemoryContext context = memory.getContext(sessionId,
                ContextOptions.defaults().toBuilder().branchId(branch.getId()).includeAncestry(true).build()).block();

        assertThat(context.systemPrompt()).isEqualTo("You are terse.");
        assertThat(context.messages()).extracting(Message::getContent).containsExactly("Hello", "Hello again");
        assertThat(memory.getSession(sessionId).block().activeBranch()).contains(branch.getId());
    }

    private static Message message(String id, String sessionId, Role role, String content, long ts) {
        return Message.builder().id(id).sessionId(sessionId).role(role).content(content).timestamp(ts).build();
    }
}
