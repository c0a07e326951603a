package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.ArchiveQuery;
import com.fastchat.memory.api.dto.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Optional long-term copy of messages that outlives the TTL-bounded store.
 * Writes are advisory: callers never fail a memory operation because of this sink.
 */
public interface ArchivalSink {

    Mono<Void> upsertMessage(Message message);

    /** Oldest first. */
    Flux<Message> queryMessages(String sessionId, ArchiveQuery query);

    Mono<Void> deleteSession(String sessionId);

    boolean isEnabled();
}
