package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.ArchiveQuery;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.service.ArchivalSink;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class NoopArchivalSink implements ArchivalSink {

    @Override
    public Mono<Void> upsertMessage(Message message) {
        return Mono.empty();
    }

    @Override
    public Flux<Message> queryMessages(String sessionId, ArchiveQuery query) {
        return Flux.empty();
    }

    @Override
    public Mono<Void> deleteSession(String sessionId) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
