package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.ContextOptions;
import com.fastchat.memory.api.dto.MemoryContext;
import com.fastchat.memory.api.dto.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ContextAssembler {

    /** Never errors on an empty session; emits {@link MemoryContext#empty} instead. */
    Mono<MemoryContext> assembleContext(String sessionId, ContextOptions options);

    Flux<Message> findRelevantMessages(String sessionId, String query, int limit);
}
